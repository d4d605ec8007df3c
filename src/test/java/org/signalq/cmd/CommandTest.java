/**
 *
 */
package org.signalq.cmd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end tests for the conversion commands.
 *
 */
public class CommandTest {

    /** CellDesigner test diagram */
    private static final String CD_FILE = new File("data", "simple_cd.xml").getPath();

    @Test
    public void testQual(@TempDir File tempDir) throws IOException {
        File outFile = new File(tempDir, "simple.sbml");
        QualProcessor processor = new QualProcessor();
        boolean ok = processor.parseCommand(new String[] { "-r", "-1", "--csv", "--sif", CD_FILE, outFile.getPath() });
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(FileUtils.readFileToString(outFile, StandardCharsets.UTF_8), containsString("tr_sa4"));
        List<String> csv = FileUtils.readLines(new File(tempDir, "simple.csv"), StandardCharsets.UTF_8);
        assertThat(csv.size(), equalTo(6));
        List<String> bnet = FileUtils.readLines(new File(tempDir, "simple.bnet"), StandardCharsets.UTF_8);
        assertThat(bnet, hasItem("D_phosphorylated, (A | (B & !C))"));
        List<String> sif = FileUtils.readLines(new File(tempDir, "simple.sif"), StandardCharsets.UTF_8);
        assertThat(sif, hasItems("sa1\tPOSITIVE\tsa4", "sa3\tNEGATIVE\tsa4"));
        assertThat(sif, not(hasItem(startsWith("sa6"))));
    }

    @Test
    public void testBma(@TempDir File tempDir) throws IOException {
        File outFile = new File(tempDir, "simple.json");
        BmaProcessor processor = new BmaProcessor();
        assertThat(processor.parseCommand(new String[] { "-g", "0", CD_FILE, outFile.getPath() }), equalTo(false));
        processor = new BmaProcessor();
        boolean ok = processor.parseCommand(new String[] { "-u", "D_phosphorylated", "-i", "0", CD_FILE,
                outFile.getPath() });
        assertThat(ok, equalTo(true));
        processor.run();
        String text = FileUtils.readFileToString(outFile, StandardCharsets.UTF_8);
        assertThat(text, containsString("CaSQ-BMA"));
        assertThat(text, not(containsString("C1_complex")));
    }

    @Test
    public void testFunctions(@TempDir File tempDir) throws IOException {
        File outFile = new File(tempDir, "functions.tbl");
        FunctionsProcessor processor = new FunctionsProcessor();
        boolean ok = processor.parseCommand(new String[] { "-n", "--noSelfLoops", "-f",
                new File("data", "fixed.csv").getPath(), "-o", outFile.getPath(), CD_FILE });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines.size(), equalTo(8));
        assertThat(lines.get(0), equalTo("species_id\tname\ttype\tfunction"));
        assertThat(lines, hasItems("C1_complex\tC1_complex\tCOMPLEX\tC", "A\tA\tPROTEIN\t1", "C\tC\tPROTEIN\t0",
                "B\tB\tPROTEIN\t(input)", "D_phosphorylated\tD_phosphorylated\tPROTEIN\t(A | (B & !C))",
                "Y\tY\tPROTEIN\tX"));
    }

    @Test
    public void testComponents(@TempDir File tempDir) throws IOException {
        File outFile = new File(tempDir, "components.tbl");
        ComponentsProcessor processor = new ComponentsProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), CD_FILE });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines, contains("component\tsize\tspecies", "1\t5\tC1_complex, A, B, C, D_phosphorylated",
                "2\t2\tX, Y"));
    }

    @Test
    public void testReportOnBadDiagram(@TempDir File tempDir) {
        File outFile = new File(tempDir, "components.tbl");
        ComponentsProcessor processor = new ComponentsProcessor();
        boolean ok = processor.parseCommand(new String[] { "--format", "SBGN", "-o", outFile.getPath(), CD_FILE });
        assertThat(ok, equalTo(false));
        assertThat(outFile.exists(), equalTo(false));
    }

}
