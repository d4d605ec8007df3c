/**
 *
 */
package org.signalq.logic;

/**
 * This object represents a directed, signed influence of one numbered variable on another.
 *
 */
public class Relationship {

    // FIELDS
    /** relationship ID */
    private int id;
    /** source variable ID */
    private int from;
    /** target variable ID */
    private int to;
    /** relationship type */
    private Type type;

    /**
     * This enumeration describes the sign of a relationship.
     */
    public static enum Type {
        ACTIVATOR("Activator"), INHIBITOR("Inhibitor");

        /** name used in output files */
        private String label;

        private Type(String label) {
            this.label = label;
        }

        /**
         * @return the name used in output files
         */
        public String getLabel() {
            return this.label;
        }

    }

    /**
     * Create a relationship.
     *
     * @param id		relationship ID
     * @param from		source variable ID
     * @param to		target variable ID
     * @param type		relationship type
     */
    public Relationship(int id, int from, int to, Type type) {
        this.id = id;
        this.from = from;
        this.to = to;
        this.type = type;
    }

    /**
     * @return the relationship ID
     */
    public int getId() {
        return this.id;
    }

    /**
     * @return the source variable ID
     */
    public int getFrom() {
        return this.from;
    }

    /**
     * @return the target variable ID
     */
    public int getTo() {
        return this.to;
    }

    /**
     * @return the relationship type
     */
    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        return "Relationship " + this.id + " (" + this.from + " -> " + this.to + ", " + this.type.getLabel() + ")";
    }

}
