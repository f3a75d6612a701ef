package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A test (or task) and everything it ran.
 */
public final class TestCase extends StatusObject<TestCase> implements ItemParent {

    private static final AttributeTable<TestCase> ATTRIBUTES = statusAttributes(
            AttributeTable.<TestCase>builder("TestCase")
                    .add("name", TestCase::getName, TestCase::setName, Coercions.STRING)
                    .add("doc", TestCase::getDoc, TestCase::setDoc, Coercions.STRING)
                    .add("tags", TestCase::getTags, TestCase::setTags, ResultCoercions.TAGS)
                    .add("timeout", TestCase::getTimeout, TestCase::setTimeout, Coercions.STRING)
                    .add("lineno", TestCase::getLineno, TestCase::setLineno, Coercions.INTEGER)
                    .add("setup", TestCase::getSetup, TestCase::setSetup, ResultCoercions.AS_IS)
                    .add("teardown", TestCase::getTeardown, TestCase::setTeardown, ResultCoercions.AS_IS),
            true)
            .add("body", TestCase::getBody, TestCase::setBody, ResultCoercions.ITEMS)
            .build();

    private TestSuite parent;
    private String name = "";
    private String doc = "";
    private Tags tags = new Tags();
    private String timeout;
    private Integer lineno;
    private Keyword setup;
    private Keyword teardown;
    private Body body = new Body(this, Body.STEPS);

    public TestCase() {
    }

    public TestCase(String name) {
        setName(name);
    }

    public static TestCase fromDict(Map<String, ?> data) {
        return fromDict(TestCase::new, data);
    }

    public static TestCase fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static TestCase fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<TestCase> attributeTable() {
        return ATTRIBUTES;
    }

    public TestSuite getParent() {
        return parent;
    }

    void setParent(TestSuite parent) {
        this.parent = parent;
    }

    /** {@code <suite id>-t<n>}, e.g. {@code s1-s2-t3}. */
    @Override
    public String getId() {
        if (parent == null) return "t1";
        return parent.getId() + "-t" + (StatusItem.indexOf(parent.getTests(), this) + 1);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    /** Parent suite's full name and this test's name joined with a dot. */
    public String getFullName() {
        return parent == null ? name : parent.getFullName() + "." + name;
    }

    /** Source of the parent suite; null without a parent. */
    public Path getSource() {
        return parent == null ? null : parent.getSource();
    }

    public String getDoc() {
        return doc;
    }

    public void setDoc(String doc) {
        this.doc = doc != null ? doc : "";
    }

    public Tags getTags() {
        return tags;
    }

    public void setTags(Tags tags) {
        this.tags = tags != null ? tags : new Tags();
    }

    public String getTimeout() {
        return timeout;
    }

    public void setTimeout(String timeout) {
        this.timeout = timeout;
    }

    public Integer getLineno() {
        return lineno;
    }

    public void setLineno(Integer lineno) {
        this.lineno = lineno;
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

    public Body getBody() {
        return body;
    }

    public void setBody(List<?> items) {
        body.replaceWith(items);
    }

    @Override
    public List<BodyItem> getSteps() {
        return Keyword.fixtureSteps(hasSetup() ? setup : null, body.getSteps(), hasTeardown() ? teardown : null);
    }

    @Override
    public List<Message> getMessages() {
        return body.getMessages();
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        tags = new Tags(tags);
        body = body.deepCopy(this);
        if (setup != null) {
            setup = setup.deepCopy();
            setup.setParent(this);
        }
        if (teardown != null) {
            teardown = teardown.deepCopy();
            teardown.setParent(this);
        }
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        if (!doc.isEmpty()) data.put("doc", doc);
        if (!tags.isEmpty()) data.put("tags", tags.asList());
        if (timeout != null) data.put("timeout", timeout);
        if (lineno != null) data.put("lineno", lineno);
        if (hasSetup()) data.put("setup", setup.toDict());
        if (hasTeardown()) data.put("teardown", teardown.toDict());
        putStatusData(data);
        if (!body.isEmpty()) data.put("body", body.toDicts());
        return data;
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("name");
    }
}
