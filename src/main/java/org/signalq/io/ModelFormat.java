/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;

import org.signalq.network.SignalModel;

/**
 * This enumeration lists the diagram formats that can be read into a signalling model.
 *
 */
public enum ModelFormat {
    /** CellDesigner SBML */
    CD {
        @Override
        public SignalModel read(File inFile) throws IOException {
            return new CellDesignerReader().read(inFile);
        }
    },
    /** SBGN-ML */
    SBGN {
        @Override
        public SignalModel read(File inFile) throws IOException {
            return new SbgnReader().read(inFile);
        }
    };

    /**
     * Read a signalling model from a diagram file in this format.
     *
     * @param inFile	diagram file to read
     *
     * @return the model read
     *
     * @throws IOException
     */
    public abstract SignalModel read(File inFile) throws IOException;

}
