package net.littleredcomputer.gadget2sat;

import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private List<String> run(String task, String problem) throws Exception {
        File in = folder.newFile();
        Files.asCharSink(in, StandardCharsets.UTF_8).write(problem);
        File out = new File(folder.getRoot(), "results.txt");
        Main.main(new String[]{"-task", task, "-problem", in.getPath(), "-out", out.getPath()});
        return Files.asCharSource(out, StandardCharsets.UTF_8).readLines();
    }

    @Test
    public void solveWritesResults() throws Exception {
        List<String> lines = run("solve", "1 2 3\n-1 -2 -3\n");
        assertThat(lines, hasItem("s SATISFIABLE"));
        assertThat(lines, hasItem(startsWith("v ")));
    }

    @Test
    public void solveUnsatisfiable() throws Exception {
        List<String> lines = run("solve", TestFormulas.allSigns3().toDimacs("all signs"));
        assertThat(lines, hasItem("s UNSATISFIABLE"));
        assertThat(lines, not(hasItem(startsWith("v "))));
    }

    @Test
    public void decide() throws Exception {
        List<String> lines = run("decide", "p cnf 2 2\n1 2 0\n-1 -1 0\n");
        assertThat(lines, hasItem("s SATISFIABLE"));
        assertThat(lines, hasItem("v -1 2 0"));
    }
}
