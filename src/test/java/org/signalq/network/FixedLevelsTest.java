/**
 *
 */
package org.signalq.network;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.signalq.utils.ParseFailureException;

/**
 * Tests for fixed species levels.
 *
 */
public class FixedLevelsTest {

    @Test
    public void testLoad() throws IOException, ParseFailureException {
        FixedLevels levels = new FixedLevels(new File("data", "fixed.csv"));
        assertThat(levels.getLevels(), allOf(hasEntry("A", 1), hasEntry("C", 0)));
        assertThat(levels.getLevels().size(), equalTo(2));
        SignalModel model = new SignalModel(100.0, 100.0);
        Species a = new Species("s1", "A", Species.PROTEIN);
        Species b = new Species("s2", "B", Species.PROTEIN);
        model.addSpecies(a);
        model.addSpecies(b);
        assertThat(levels.apply(model), equalTo(1));
        assertThat(a.getFixedLevel(), equalTo(1));
        assertThat(b.getFixedLevel(), nullValue());
    }

    @Test
    public void testBadFile() {
        assertThrows(ParseFailureException.class, () -> new FixedLevels(new File("data", "fixed_bad.csv")));
        FixedLevels levels = new FixedLevels();
        assertThat(levels.isEmpty(), equalTo(true));
        levels.put("X", 0);
        assertThat(levels.isEmpty(), equalTo(false));
    }

}
