/**
 *
 */
package org.signalq.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.signalq.logic.FunctionSynthesizer;
import org.signalq.logic.LogicalModel;
import org.signalq.network.SignalModel;

/**
 * Tests for the CSV, BoolNet, and SIF renderers.
 *
 */
public class TableWriterTest {

    @Test
    public void testCsv() throws IOException {
        SignalModel model = BmaWriterTest.buildModel();
        FunctionSynthesizer.create(1, false).synthesize(model);
        StringWriter writer = new StringWriter();
        new SpeciesCsvWriter().writeCsv(model, writer);
        try (CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().parse(new StringReader(writer.toString()))) {
            assertThat(parser.getHeaderNames(), contains(SpeciesCsvWriter.CSV_HEADERS));
            List<CSVRecord> records = parser.getRecords();
            assertThat(records.size(), equalTo(5));
            CSVRecord recD = records.get(3);
            assertThat(recD.get("Species_id"), equalTo("D"));
            assertThat(recD.get("Compartment"), equalTo("nucleus"));
            assertThat(recD.get("Activity"), equalTo("inactive"));
            assertThat(recD.get("Receptor"), equalTo("false"));
            assertThat(Double.parseDouble(recD.get("X")), closeTo(30.0, 0.001));
            assertThat(recD.get("Function"), equalTo("(A | (B & !C))"));
            assertThat(records.get(0).get("Function"), equalTo("A"));
        }
    }

    @Test
    public void testBnet() throws IOException {
        SignalModel model = BmaWriterTest.buildModel();
        FunctionSynthesizer.create(1, false).synthesize(model);
        StringWriter writer = new StringWriter();
        new SpeciesCsvWriter().writeBnet(model, writer);
        String[] lines = writer.toString().split("\\R");
        assertThat(lines.length, equalTo(6));
        assertThat(lines[0], equalTo(SpeciesCsvWriter.BNET_HEADER));
        assertThat(lines[1], equalTo("A, A"));
        assertThat(lines[4], equalTo("D, (A | (B & !C))"));
        assertThat(lines[5], equalTo("E, !D"));
    }

    @Test
    public void testSif() throws IOException {
        SignalModel model = BmaWriterTest.buildModel();
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(model);
        StringWriter writer = new StringWriter();
        int count = new SifWriter().write(logical, writer);
        assertThat(count, equalTo(4));
        String[] lines = writer.toString().split("\\R");
        assertThat(lines, arrayContaining("A\tPOSITIVE\tD", "B\tPOSITIVE\tD", "C\tNEGATIVE\tD", "D\tNEGATIVE\tE"));
    }

    @Test
    public void testFiles(@TempDir File tempDir) throws IOException {
        SignalModel model = BmaWriterTest.buildModel();
        LogicalModel logical = FunctionSynthesizer.create(1, false).synthesize(model);
        File base = new File(tempDir, "model.sbml");
        new SpeciesCsvWriter().write(model, base);
        File csvFile = new File(tempDir, "model.csv");
        File bnetFile = new File(tempDir, "model.bnet");
        assertThat(csvFile.exists(), equalTo(true));
        assertThat(FileUtils.readLines(bnetFile, StandardCharsets.UTF_8).size(), equalTo(6));
        File sifFile = SpeciesCsvWriter.replaceExtension(base, ".sif");
        assertThat(sifFile.getName(), equalTo("model.sif"));
        new SifWriter().write(logical, sifFile);
        assertThat(FileUtils.readLines(sifFile, StandardCharsets.UTF_8), hasItem("C\tNEGATIVE\tD"));
    }

}
