/**
 *
 */
package org.signalq.logic;

/**
 * This object hands out sequential integer IDs.  It is passed explicitly to everything that needs to
 * number objects in the same ID space.
 *
 */
public class IdCounter {

    // FIELDS
    /** next ID to return */
    private int next;

    /**
     * Create a counter.
     *
     * @param first		first ID to return
     */
    public IdCounter(int first) {
        this.next = first;
    }

    /**
     * @return the next ID
     */
    public int next() {
        return this.next++;
    }

    /**
     * @return the ID that will be returned next, without using it
     */
    public int peek() {
        return this.next;
    }

}
