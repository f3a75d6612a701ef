package com.runtree.xml.handlers;

import com.runtree.config.RunTreeConfig;
import com.runtree.model.DataException;
import com.runtree.model.result.For;
import com.runtree.model.result.Iteration;
import com.runtree.model.result.Keyword;
import com.runtree.model.result.Result;
import com.runtree.model.result.Status;
import com.runtree.model.result.TestCase;
import com.runtree.model.result.TestSuite;
import com.runtree.xml.ExecutionResultReader;
import com.runtree.xml.InvalidElementException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordHandlerTest {

    @Test
    void suiteLevelKeyword_beforeTestsGoesToImplicitSetup() {
        TestSuite suite = read("""
                <suite name="S">
                  <kw name="Listener Log"><status status="PASS"/></kw>
                  <test name="T"><status status="PASS"/></test>
                </suite>
                """).getSuite();

        Keyword setup = suite.getSetup();
        assertEquals("Implicit setup", setup.getName());
        assertEquals(Status.PASS, setup.getStatus());
        assertEquals("Listener Log", ((Keyword) setup.getBody().get(0)).getName());
        assertFalse(suite.hasTeardown());
        assertEquals(Status.PASS, suite.getStatus());
    }

    @Test
    void suiteLevelKeyword_afterTestsGoesToImplicitTeardown() {
        TestSuite suite = read("""
                <suite name="S">
                  <test name="T"><status status="PASS"/></test>
                  <kw name="First"><status status="PASS"/></kw>
                  <kw name="Second"><status status="PASS"/></kw>
                </suite>
                """).getSuite();

        assertFalse(suite.hasSetup());
        Keyword teardown = suite.getTeardown();
        assertEquals("Implicit teardown", teardown.getName());
        assertEquals(Status.PASS, teardown.getStatus());
        assertEquals(2, teardown.getBody().size());
        assertEquals("s1-k1", teardown.getId());
        assertEquals("s1-k1-k2", teardown.getBody().get(1).getId());
    }

    @Test
    void suiteLevelKeyword_realSetupReplacesPlaceholderButKeepsBody() {
        Keyword setup = read("""
                <suite name="S">
                  <kw name="Early"><status status="PASS"/></kw>
                  <kw type="SETUP" name="Real Setup" owner="Lib"><status status="FAIL">Broken</status></kw>
                  <test name="T"><status status="PASS"/></test>
                </suite>
                """).getSuite().getSetup();

        assertEquals("Real Setup", setup.getName());
        assertEquals("Lib", setup.getOwner());
        assertEquals(Status.FAIL, setup.getStatus());
        assertEquals("Broken", setup.getMessage());
        assertEquals("Early", ((Keyword) setup.getBody().get(0)).getName());
    }

    @Test
    void fixtures_ofTestsAndKeywords() {
        TestCase test = read("""
                <suite name="S">
                  <test name="T">
                    <kw type="SETUP" name="Prepare"><status status="PASS"/></kw>
                    <kw name="Step">
                      <kw type="TEARDOWN" name="Clean Step"><status status="PASS"/></kw>
                      <status status="PASS"/>
                    </kw>
                    <kw type="teardown" name="Clean"><status status="PASS"/></kw>
                    <status status="PASS"/>
                  </test>
                </suite>
                """).getSuite().getTests().get(0);

        assertEquals("Prepare", test.getSetup().getName());
        assertEquals("Clean", test.getTeardown().getName());
        assertEquals(1, test.getBody().size());
        Keyword step = (Keyword) test.getBody().get(0);
        assertEquals("Clean Step", step.getTeardown().getName());
        assertEquals("s1-t1-k2", step.getId());
        assertEquals("s1-t1-k3", test.getTeardown().getId());
    }

    @Test
    void legacyAttributeNames() {
        Keyword kw = firstKeyword("""
                <kw name="Log Many" library="BuiltIn" sourcename="Log ${what}">
                  <arguments><arg>a</arg><arg>b</arg></arguments>
                  <assign><var>${x}</var></assign>
                  <tags><tag>t</tag></tags>
                  <timeout value="1s"/>
                  <status status="PASS"/>
                </kw>
                """);
        assertEquals("BuiltIn", kw.getOwner());
        assertEquals("Log ${what}", kw.getSourceName());
        assertEquals("BuiltIn.Log Many", kw.getFullName());
        assertEquals(List.of("a", "b"), kw.getArgs());
        assertEquals(List.of("${x}"), kw.getAssign());
        assertTrue(kw.getTags().contains("t"));
        assertEquals("1s", kw.getTimeout());
    }

    @Test
    void currentAttributeNamesWin() {
        Keyword kw = firstKeyword("""
                <kw name="Log" owner="Current" library="Old" source_name="New" sourcename="Old"><status status="PASS"/></kw>
                """);
        assertEquals("Current", kw.getOwner());
        assertEquals("New", kw.getSourceName());
    }

    @Test
    void legacyForKeyword_becomesFor() {
        TestCase test = read("""
                <suite name="S">
                  <test name="T">
                    <kw type="for" name="${x} | ${y} IN ZIP [ @{a} | @{b} ]">
                      <kw type="foritem" name="${x} = 1, ${y} = 2">
                        <kw name="Log" library="BuiltIn">
                          <arguments><arg>${x}</arg></arguments>
                          <status status="PASS" starttime="20200101 00:00:00.000" endtime="20200101 00:00:00.010"/>
                        </kw>
                        <status status="PASS"/>
                      </kw>
                      <kw type="iteration" name="${x} = 3, ${y} = 4"><status status="PASS"/></kw>
                      <status status="PASS"/>
                    </kw>
                    <status status="PASS"/>
                  </test>
                </suite>
                """).getSuite().getTests().get(0);

        For loop = assertInstanceOf(For.class, test.getBody().get(0));
        assertEquals(List.of("${x}", "${y}"), loop.getAssign());
        assertEquals("IN ZIP", loop.getFlavor());
        assertEquals(List.of("@{a}", "@{b}"), loop.getValues());
        assertEquals(2, loop.getBody().size());
        Iteration first = assertInstanceOf(Iteration.class, loop.getBody().get(0));
        assertEquals(Map.of("${x}", "1", "${y}", "2"), first.getAssign());
        Keyword log = (Keyword) first.getBody().get(0);
        assertEquals(List.of("${x}"), log.getArgs());
        assertEquals(Duration.ofMillis(10), log.getElapsedTime());
        assertEquals(Map.of("${x}", "3", "${y}", "4"), ((Iteration) loop.getBody().get(1)).getAssign());
    }

    @Test
    void legacyForKeyword_rejectsArguments() {
        InvalidElementException e = assertThrows(InvalidElementException.class, () -> read("""
                <suite name="S"><test name="T">
                  <kw type="for" name="${i} IN RANGE [ 3 ]"><arg>x</arg></kw>
                </test></suite>
                """));
        assertEquals("arg", e.getTag());
        assertInstanceOf(For.class, e.getNode());
        assertTrue(e.getMessage().startsWith("Invalid element 'arg' for result 'For("), e.getMessage());
    }

    @Test
    void unsupportedType() {
        DataException e = assertThrows(DataException.class, () -> firstKeyword("<kw type=\"bogus\" name=\"x\"/>"));
        assertEquals("Unsupported keyword type 'bogus'.", e.getMessage());
    }

    @Test
    void kind_isCaseInsensitive() {
        assertEquals(KeywordHandler.Kind.SETUP, KeywordHandler.Kind.of("Setup"));
        assertEquals(KeywordHandler.Kind.KEYWORD, KeywordHandler.Kind.of(null));
        assertEquals(KeywordHandler.Kind.KEYWORD, KeywordHandler.Kind.of(""));
        assertEquals(KeywordHandler.Kind.FORITEM, KeywordHandler.Kind.of("foritem"));
    }

    private static Keyword firstKeyword(String kw) {
        Result result = read("<suite name=\"S\"><test name=\"T\">" + kw + "<status status=\"PASS\"/></test></suite>");
        return (Keyword) result.getSuite().getTests().get(0).getBody().get(0);
    }

    static Result read(String xml) {
        return new ExecutionResultReader(RunTreeConfig.defaults()).read(xml);
    }

    @Test
    void assignedVariable_notAllowedOnFixtures() {
        InvalidElementException e = assertThrows(InvalidElementException.class, () -> read("""
                <suite name="S">
                  <test name="T">
                    <kw name="Prepare" type="SETUP"><var>${x}</var></kw>
                    <status status="PASS"/>
                  </test>
                </suite>
                """));
        assertEquals("var", e.getTag());
        assertTrue(e.getMessage().startsWith("Invalid element 'var' for result 'Keyword("), e.getMessage());
    }
}
