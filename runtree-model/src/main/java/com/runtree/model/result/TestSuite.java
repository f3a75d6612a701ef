package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.DataException;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A suite with its child suites and tests.
 *
 * <p>The status of a suite is not stored: it is FAIL when the setup or anything below the
 * suite failed, PASS when something passed and SKIP otherwise. Dictionary data may contain
 * {@code status} only if it agrees with the computed value.
 */
public final class TestSuite extends StatusObject<TestSuite> implements ItemParent {

    private static final AttributeTable<TestSuite> ATTRIBUTES = statusAttributes(
            AttributeTable.<TestSuite>builder("TestSuite")
                    .add("name", TestSuite::getName, TestSuite::setName, Coercions.STRING)
                    .add("doc", TestSuite::getDoc, TestSuite::setDoc, Coercions.STRING)
                    .add("metadata", TestSuite::getMetadata, TestSuite::setMetadata, Coercions.STRING_MAP)
                    .add("source", TestSuite::getSource, TestSuite::setSource, Coercions.PATH)
                    .add("rpa", TestSuite::getRpa, TestSuite::setRpa, Coercions.BOOLEAN)
                    .add("setup", TestSuite::getSetup, TestSuite::setSetup, ResultCoercions.AS_IS)
                    .add("teardown", TestSuite::getTeardown, TestSuite::setTeardown, ResultCoercions.AS_IS)
                    .add("tests", TestSuite::getTests, TestSuite::setTests, ResultCoercions.ITEMS)
                    .add("suites", TestSuite::getSuites, TestSuite::setSuites, ResultCoercions.ITEMS),
            false)
            .build();

    private TestSuite parent;
    private String name = "";
    private String doc = "";
    private Map<String, String> metadata = new LinkedHashMap<>();
    private Path source;
    private Boolean rpa;
    private Keyword setup;
    private Keyword teardown;
    private List<TestSuite> suites = new ArrayList<>();
    private List<TestCase> tests = new ArrayList<>();

    public TestSuite() {
    }

    public TestSuite(String name) {
        setName(name);
    }

    public static TestSuite fromDict(Map<String, ?> data) {
        return fromDict(TestSuite::new, data);
    }

    public static TestSuite fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static TestSuite fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<TestSuite> attributeTable() {
        return ATTRIBUTES;
    }

    public TestSuite getParent() {
        return parent;
    }

    /** {@code s1} for the root suite, {@code <parent id>-s<n>} for child suites. */
    @Override
    public String getId() {
        if (parent == null) return "s1";
        return parent.getId() + "-s" + (StatusItem.indexOf(parent.suites, this) + 1);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    /** Parent suite names and this suite's name joined with dots. */
    public String getFullName() {
        return parent == null ? name : parent.getFullName() + "." + name;
    }

    public String getDoc() {
        return doc;
    }

    public void setDoc(String doc) {
        this.doc = doc != null ? doc : "";
    }

    /** Mutable, insertion-ordered; a repeated name replaces the earlier value. */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public Path getSource() {
        return source;
    }

    public void setSource(Path source) {
        this.source = source;
    }

    /** True when the suite contains tasks, null when not known. */
    public Boolean getRpa() {
        return rpa;
    }

    public void setRpa(Boolean rpa) {
        this.rpa = rpa;
    }

    @Override
    public Status getStatus() {
        if (hasSetup() && setup.isFailed()) return Status.FAIL;
        boolean passed = false;
        for (TestCase test : tests) {
            if (test.isFailed()) return Status.FAIL;
            passed |= test.isPassed();
        }
        for (TestSuite suite : suites) {
            Status status = suite.getStatus();
            if (status == Status.FAIL) return Status.FAIL;
            passed |= status == Status.PASS;
        }
        return passed ? Status.PASS : Status.SKIP;
    }

    public Keyword getSetup() {
        if (setup == null) {
            setup = Keyword.fixture(null, ItemType.SETUP, this);
        }
        return setup;
    }

    public void setSetup(Object setup) {
        this.setup = Keyword.fixture(setup, ItemType.SETUP, this);
    }

    public boolean hasSetup() {
        return setup != null && setup.isDefined();
    }

    public Keyword getTeardown() {
        if (teardown == null) {
            teardown = Keyword.fixture(null, ItemType.TEARDOWN, this);
        }
        return teardown;
    }

    public void setTeardown(Object teardown) {
        this.teardown = Keyword.fixture(teardown, ItemType.TEARDOWN, this);
    }

    public boolean hasTeardown() {
        return teardown != null && teardown.isDefined();
    }

    public List<TestSuite> getSuites() {
        return Collections.unmodifiableList(suites);
    }

    /** Replaces child suites with the given suites or suite dictionaries. */
    public void setSuites(List<?> items) {
        List<?> snapshot = new ArrayList<>(items);
        suites.clear();
        for (Object item : snapshot) {
            if (item instanceof TestSuite suite) {
                addSuite(suite);
            } else if (item instanceof Map<?, ?> data) {
                createSuite(Body.asData(data));
            } else {
                throw new DataException("Suites must be suites or dictionaries, got '" + item + "'.");
            }
        }
    }

    public TestSuite createSuite() {
        return createSuite(Map.of());
    }

    public TestSuite createSuite(Map<String, ?> data) {
        TestSuite suite = new TestSuite();
        suite.parent = this;
        suite.config(data);
        suites.add(suite);
        return suite;
    }

    public TestSuite addSuite(TestSuite suite) {
        suite.parent = this;
        suites.add(suite);
        return suite;
    }

    public List<TestCase> getTests() {
        return Collections.unmodifiableList(tests);
    }

    /** Replaces tests with the given tests or test dictionaries. */
    public void setTests(List<?> items) {
        List<?> snapshot = new ArrayList<>(items);
        tests.clear();
        for (Object item : snapshot) {
            if (item instanceof TestCase test) {
                addTest(test);
            } else if (item instanceof Map<?, ?> data) {
                createTest(Body.asData(data));
            } else {
                throw new DataException("Tests must be tests or dictionaries, got '" + item + "'.");
            }
        }
    }

    public TestCase createTest() {
        return createTest(Map.of());
    }

    public TestCase createTest(Map<String, ?> data) {
        TestCase test = new TestCase();
        test.setParent(this);
        test.config(data);
        tests.add(test);
        return test;
    }

    public TestCase addTest(TestCase test) {
        test.setParent(this);
        tests.add(test);
        return test;
    }

    /** Number of tests in this suite and all its child suites. */
    public int getTestCount() {
        int count = tests.size();
        for (TestSuite suite : suites) {
            count += suite.getTestCount();
        }
        return count;
    }

    @Override
    public List<BodyItem> getSteps() {
        return Keyword.fixtureSteps(hasSetup() ? setup : null, List.of(), hasTeardown() ? teardown : null);
    }

    @Override
    public List<Message> getMessages() {
        return List.of();
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        metadata = new LinkedHashMap<>(metadata);
        if (setup != null) {
            setup = setup.deepCopy();
            setup.setParent(this);
        }
        if (teardown != null) {
            teardown = teardown.deepCopy();
            teardown.setParent(this);
        }
        List<TestSuite> originalSuites = suites;
        suites = new ArrayList<>();
        for (TestSuite suite : originalSuites) {
            addSuite(suite.deepCopy());
        }
        List<TestCase> originalTests = tests;
        tests = new ArrayList<>();
        for (TestCase test : originalTests) {
            addTest(test.deepCopy());
        }
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        if (!doc.isEmpty()) data.put("doc", doc);
        if (!metadata.isEmpty()) data.put("metadata", new LinkedHashMap<>(metadata));
        if (source != null) data.put("source", source.toString());
        if (rpa != null) data.put("rpa", rpa);
        if (hasSetup()) data.put("setup", setup.toDict());
        if (hasTeardown()) data.put("teardown", teardown.toDict());
        if (!tests.isEmpty()) data.put("tests", toDicts(tests));
        if (!suites.isEmpty()) data.put("suites", toDicts(suites));
        putStatusData(data);
        return data;
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("name");
    }

    private static List<Map<String, Object>> toDicts(List<? extends StatusObject<?>> items) {
        List<Map<String, Object>> dicts = new ArrayList<>(items.size());
        for (StatusObject<?> item : items) {
            dicts.add(item.toDict());
        }
        return dicts;
    }
}
