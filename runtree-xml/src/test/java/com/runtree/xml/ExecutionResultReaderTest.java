package com.runtree.xml;

import com.runtree.config.RunTreeConfig;
import com.runtree.model.DataException;
import com.runtree.model.result.Branch;
import com.runtree.model.result.Break;
import com.runtree.model.result.For;
import com.runtree.model.result.Group;
import com.runtree.model.result.If;
import com.runtree.model.result.ItemType;
import com.runtree.model.result.Iteration;
import com.runtree.model.result.Keyword;
import com.runtree.model.result.Message;
import com.runtree.model.result.MessageLevel;
import com.runtree.model.result.Result;
import com.runtree.model.result.Status;
import com.runtree.model.result.TestCase;
import com.runtree.model.result.TestSuite;
import com.runtree.model.result.Try;
import com.runtree.model.result.Var;
import com.runtree.model.result.While;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionResultReaderTest {

    private final ExecutionResultReader reader = new ExecutionResultReader(RunTreeConfig.defaults());

    @Test
    void read_sampleReport() throws IOException {
        Result result = readSample(reader);

        assertEquals("Robot 7.1 (Python 3.12.1 on linux)", result.getGenerator());
        assertEquals(LocalDateTime.of(2024, 5, 2, 10, 15, 30, 123_456_000), result.getGenerated());
        assertFalse(result.isRpa());

        TestSuite root = result.getSuite();
        assertEquals("Project", root.getName());
        assertEquals(Path.of("/work/project"), root.getSource());
        assertEquals(Boolean.FALSE, root.getRpa());
        assertEquals(2, root.getTestCount());
        assertEquals(Status.FAIL, root.getStatus());

        TestSuite login = root.getSuites().get(0);
        assertEquals("s1-s1", login.getId());
        assertEquals("Project.Login", login.getFullName());
        assertEquals("Login tests.", login.getDoc());
        assertEquals(Map.of("Owner", "QA"), login.getMetadata());
        assertEquals(LocalDateTime.of(2024, 5, 2, 10, 15, 30, 190_000_000), login.getStartTime());
        assertEquals(Duration.ofMillis(2110), login.getElapsedTime());
        assertTrue(login.hasSetup());
        assertEquals("Open Browser", login.getSetup().getName());
        assertEquals("Browser.Open Browser", login.getSetup().getFullName());
        assertEquals(List.of("https://example.com"), login.getSetup().getArgs());
        assertEquals("Opens a browser.", login.getSetup().getDoc());
        assertEquals(Status.PASS, login.getSetup().getStatus());
        assertEquals("Close Browser", login.getTeardown().getName());
    }

    @Test
    void read_sampleTestBodies() throws IOException {
        TestSuite login = readSample(reader).getSuite().getSuites().get(0);
        TestCase valid = login.getTests().get(0);
        assertEquals("s1-s1-t1", valid.getId());
        assertEquals(12, valid.getLineno());
        assertEquals("Logs in.", valid.getDoc());
        assertEquals(List.of("login", "smoke"), valid.getTags().asList());
        assertEquals("1 minute", valid.getTimeout());
        assertEquals(Status.PASS, valid.getStatus());
        assertEquals(Duration.ofMillis(1250), valid.getElapsedTime());
        assertEquals(5, valid.getBody().size());

        Keyword input = assertInstanceOf(Keyword.class, valid.getBody().get(0));
        assertEquals(List.of("id=username", "demo"), input.getArgs());
        assertTrue(input.getTags().contains("input"));
        Message typing = input.getMessages().get(0);
        assertEquals("Typing 'demo'.", typing.getMessage());
        assertEquals("s1-s1-t1-k1-m1", typing.getId());
        assertEquals(LocalDateTime.of(2024, 5, 2, 10, 15, 30, 800_000_000), typing.getTimestamp());

        For loop = assertInstanceOf(For.class, valid.getBody().get(1));
        assertEquals("IN RANGE", loop.getFlavor());
        assertEquals(List.of("${i}"), loop.getAssign());
        assertEquals(List.of("1"), loop.getValues());
        Iteration iteration = assertInstanceOf(Iteration.class, loop.getBody().get(0));
        assertEquals(Map.of("${i}", "0"), iteration.getAssign());
        assertEquals("s1-s1-t1-k2-k1-k1", iteration.getBody().get(0).getId());

        If ifRoot = assertInstanceOf(If.class, valid.getBody().get(2));
        Branch ifBranch = (Branch) ifRoot.getBody().get(0);
        Branch elseBranch = (Branch) ifRoot.getBody().get(1);
        assertEquals(ItemType.IF, ifBranch.getType());
        assertEquals("$x > 1", ifBranch.getCondition());
        assertEquals(ItemType.ELSE, elseBranch.getType());
        assertEquals(Status.NOT_RUN, elseBranch.getStatus());

        Try tryRoot = assertInstanceOf(Try.class, valid.getBody().get(3));
        Branch tryBranch = (Branch) tryRoot.getBody().get(0);
        Branch except = (Branch) tryRoot.getBody().get(1);
        assertEquals(Status.FAIL, tryBranch.getStatus());
        assertEquals("oops", tryBranch.getMessage());
        assertEquals(ItemType.EXCEPT, except.getType());
        assertEquals(List.of("oo*"), except.getPatterns());
        assertEquals("glob", except.getPatternType());
        assertEquals("${err}", except.getAssign());

        Var var = assertInstanceOf(Var.class, valid.getBody().get(4));
        assertEquals("${result}", var.getName());
        assertEquals("TEST", var.getScope());
        assertEquals(List.of("done"), var.getValue());

        TestCase invalid = login.getTests().get(1);
        assertEquals(Status.FAIL, invalid.getStatus());
        assertEquals("a != b", invalid.getMessage());
        While whileLoop = assertInstanceOf(While.class, invalid.getBody().get(0));
        assertEquals("$i < 3", whileLoop.getCondition());
        assertEquals("10", whileLoop.getLimit());
        assertEquals("pass", whileLoop.getOnLimit());
        Iteration whileIteration = (Iteration) whileLoop.getBody().get(0);
        assertInstanceOf(Break.class, whileIteration.getBody().get(0));
        Group group = assertInstanceOf(Group.class, invalid.getBody().get(1));
        assertEquals("Checks", group.getName());
        assertEquals(Status.FAIL, group.getStatus());
    }

    @Test
    void read_sampleErrorsAndIgnoresStatistics() throws IOException {
        Result result = readSample(reader);
        assertEquals(1, result.getErrors().size());
        Message warning = result.getErrors().getMessages().get(0);
        assertEquals("Deprecated syntax.", warning.getMessage());
        assertEquals(MessageLevel.WARN, warning.getLevel());
        assertEquals("errors-m1", warning.getId());
    }

    @Test
    void read_sampleRoundTripsThroughJson() throws IOException {
        Result result = readSample(reader);
        Map<String, Object> data = result.toDict();
        assertEquals(data, Result.fromJson(result.toJson()).toDict());
    }

    @Test
    void read_pathAndStringGiveSameTree(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("output.xml");
        try (InputStream in = sample()) {
            Files.copy(in, file);
        }
        Map<String, Object> fromPath = reader.read(file).toDict();
        assertEquals(fromPath, reader.read(file.toString()).toDict());
        assertEquals(fromPath, reader.read(Files.readString(file)).toDict());
    }

    @Test
    void read_withoutKeywordsKeepsFixturesAndStatuses() throws IOException {
        ExecutionResultReader withoutKeywords =
                new ExecutionResultReader(RunTreeConfig.builder().includeKeywords(false).build());
        Result result = readSample(withoutKeywords);

        TestSuite login = result.getSuite().getSuites().get(0);
        TestCase valid = login.getTests().get(0);
        assertTrue(valid.getBody().isEmpty());
        assertEquals(Status.PASS, valid.getStatus());
        assertEquals(List.of("login", "smoke"), valid.getTags().asList());
        assertTrue(login.getTests().get(1).getBody().isEmpty());
        assertEquals(Status.FAIL, login.getTests().get(1).getStatus());
        assertEquals("Open Browser", login.getSetup().getName());
        assertEquals(Status.PASS, login.getSetup().getStatus());
        assertEquals(List.of("https://example.com"), login.getSetup().getArgs());
        assertEquals("Close Browser", login.getTeardown().getName());
        assertEquals(1, result.getErrors().size());
    }

    @Test
    void read_bareSuiteRoot() {
        Result result = reader.read("""
                <suite name="Tasks" source="tasks.robot">
                  <test name="Task">
                    <status status="PASS" start="2024-01-01T00:00:00.000000" elapsed="0.5"/>
                  </test>
                </suite>
                """);
        assertEquals("unknown", result.getGenerator());
        assertNull(result.getGenerated());
        assertEquals("Tasks", result.getSuite().getName());
        assertEquals(Status.PASS, result.getSuite().getStatus());
    }

    @Test
    void read_rpaFlagReachesSuites() {
        Result result = reader.read("""
                <robot generator="Rebot 7.0" rpa="true">
                  <suite name="Root"><suite name="Child"/></suite>
                </robot>
                """);
        assertTrue(result.isRpa());
        assertEquals(Boolean.TRUE, result.getSuite().getRpa());
        assertEquals(Boolean.TRUE, result.getSuite().getSuites().get(0).getRpa());
    }

    @Test
    void read_rejectsUnknownRoot() {
        IncompatibleElementException e = assertThrows(IncompatibleElementException.class,
                () -> reader.read("<report><suite/></report>"));
        assertEquals("Incompatible root element 'report'.", e.getMessage());
        assertTrue(e.isRoot());
    }

    @Test
    void read_rejectsKeywordUnderStatistics() {
        IncompatibleElementException e = assertThrows(IncompatibleElementException.class, () -> reader.read("""
                <robot>
                  <suite name="Root"/>
                  <statistics><kw name="Oops"/></statistics>
                </robot>
                """));
        assertEquals("Incompatible child element 'kw' for 'statistics'.", e.getMessage());
        assertEquals("statistics", e.getParentTag());
        assertEquals("kw", e.getChildTag());
    }

    @Test
    void read_malformedXmlIsDataError() {
        DataException e = assertThrows(DataException.class, () -> reader.read("<robot><suite name=\"x\"></robot>"));
        assertTrue(e.getMessage().startsWith("Reading execution result '<string>' failed: "), e.getMessage());
    }

    @Test
    void read_missingFileIsDataError(@TempDir Path dir) {
        Path missing = dir.resolve("missing.xml");
        DataException e = assertThrows(DataException.class, () -> reader.read(missing));
        assertTrue(e.getMessage().contains("missing.xml"), e.getMessage());
    }

    private static Result readSample(ExecutionResultReader reader) throws IOException {
        try (InputStream in = sample()) {
            return reader.read(in);
        }
    }

    private static InputStream sample() {
        return ExecutionResultReaderTest.class.getResourceAsStream("/output.xml");
    }
}
