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
import java.util.Locale;
import java.util.Map;

/**
 * A library or user keyword call; also used for setups and teardowns.
 *
 * <p>The {@code type} (KEYWORD, SETUP or TEARDOWN) is fixed when the keyword is created and
 * cannot be changed through {@link #config(Map)}. Setup and teardown keywords always exist
 * on their owners and count as defined once they have a name.
 */
public final class Keyword extends StatusItem<Keyword> {

    private static final AttributeTable<Keyword> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Keyword>builder("Keyword")
                    .readOnly("type", Keyword::getType, ResultCoercions.ITEM_TYPE)
                    .add("name", Keyword::getName, Keyword::setName, Coercions.STRING)
                    .add("owner", Keyword::getOwner, Keyword::setOwner, Coercions.STRING)
                    .add("source_name", Keyword::getSourceName, Keyword::setSourceName, Coercions.STRING)
                    .add("doc", Keyword::getDoc, Keyword::setDoc, Coercions.STRING)
                    .sequence("args", Keyword::getArgs, Keyword::setArgs)
                    .sequence("assign", Keyword::getAssign, Keyword::setAssign)
                    .add("tags", Keyword::getTags, Keyword::setTags, ResultCoercions.TAGS)
                    .add("timeout", Keyword::getTimeout, Keyword::setTimeout, Coercions.STRING)
                    .add("setup", Keyword::getSetup, Keyword::setSetup, ResultCoercions.AS_IS)
                    .add("teardown", Keyword::getTeardown, Keyword::setTeardown, ResultCoercions.AS_IS),
            true)).build();

    private final ItemType type;
    private String name;
    private String owner;
    private String sourceName;
    private String doc = "";
    private List<String> args = List.of();
    private List<String> assign = List.of();
    private Tags tags = new Tags();
    private String timeout;
    private Keyword setup;
    private Keyword teardown;

    public Keyword() {
        this(ItemType.KEYWORD);
    }

    Keyword(ItemType type) {
        super(Body.STEPS);
        this.type = type;
    }

    /** Creates a keyword, setup or teardown depending on the dictionary's {@code type}. */
    public static Keyword fromDict(Map<String, ?> data) {
        return fromDict(() -> new Keyword(keywordType(data.get("type"))), data);
    }

    public static Keyword fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Keyword fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Keyword> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** Library or resource file the keyword belongs to. */
    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    /** Original name of the keyword when it was called using an embedded-argument or aliased name. */
    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    /** {@code owner.name}, or just the name without an owner. */
    public String getFullName() {
        if (name == null) return null;
        return owner == null || owner.isEmpty() ? name : owner + "." + name;
    }

    public String getDoc() {
        return doc;
    }

    public void setDoc(String doc) {
        this.doc = doc != null ? doc : "";
    }

    public List<String> getArgs() {
        return args;
    }

    public void setArgs(List<String> args) {
        this.args = immutable(args);
    }

    /** Appends one argument; the argument list itself is immutable. */
    public void addArg(String arg) {
        args = append(args, arg);
    }

    public List<String> getAssign() {
        return assign;
    }

    public void setAssign(List<String> assign) {
        this.assign = immutable(assign);
    }

    public void addAssign(String variable) {
        assign = append(assign, variable);
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

    /** A keyword counts as a defined setup or teardown once it has a name. */
    public boolean isDefined() {
        return name != null;
    }

    public Keyword getSetup() {
        if (setup == null) {
            setup = fixture(null, ItemType.SETUP, this);
        }
        return setup;
    }

    /** Accepts a setup {@link Keyword}, its dictionary, or null to reset. */
    public void setSetup(Object setup) {
        this.setup = fixture(setup, ItemType.SETUP, this);
    }

    public boolean hasSetup() {
        return setup != null && setup.isDefined();
    }

    public Keyword getTeardown() {
        if (teardown == null) {
            teardown = fixture(null, ItemType.TEARDOWN, this);
        }
        return teardown;
    }

    public void setTeardown(Object teardown) {
        this.teardown = fixture(teardown, ItemType.TEARDOWN, this);
    }

    public boolean hasTeardown() {
        return teardown != null && teardown.isDefined();
    }

    @Override
    public List<BodyItem> getSteps() {
        return fixtureSteps(hasSetup() ? setup : null, getBody().getSteps(), hasTeardown() ? teardown : null);
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        tags = new Tags(tags);
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
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        if (name != null) data.put("name", name);
        if (owner != null) data.put("owner", owner);
        if (sourceName != null) data.put("source_name", sourceName);
        if (!doc.isEmpty()) data.put("doc", doc);
        if (!args.isEmpty()) data.put("args", args);
        if (!assign.isEmpty()) data.put("assign", assign);
        if (!tags.isEmpty()) data.put("tags", tags.asList());
        if (timeout != null) data.put("timeout", timeout);
        if (hasSetup()) data.put("setup", setup.toDict());
        if (hasTeardown()) data.put("teardown", teardown.toDict());
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("name", "args", "assign");
    }

    /**
     * Resolves a setup/teardown value: null creates an undefined fixture, a dictionary is
     * converted and a keyword is used as is if its type matches.
     */
    static Keyword fixture(Object value, ItemType type, ItemParent parent) {
        Keyword fixture;
        if (value == null) {
            fixture = new Keyword(type);
        } else if (value instanceof Keyword keyword) {
            if (keyword.getType() != type) {
                throw new DataException("Expected a keyword with type '" + type + "', got '" + keyword.getType() + "'.");
            }
            fixture = keyword;
        } else if (value instanceof Map<?, ?> data) {
            fixture = new Keyword(type).config(Body.asData(data));
        } else {
            throw new DataException("Invalid " + type.getValue().toLowerCase(Locale.ROOT) + " '" + value + "'.");
        }
        fixture.setParent(parent);
        return fixture;
    }

    static List<BodyItem> fixtureSteps(Keyword setup, List<BodyItem> body, Keyword teardown) {
        List<BodyItem> steps = new ArrayList<>(body.size() + 2);
        if (setup != null) steps.add(setup);
        steps.addAll(body);
        if (teardown != null) steps.add(teardown);
        return steps;
    }

    static List<String> append(List<String> values, String value) {
        List<String> result = new ArrayList<>(values);
        result.add(value);
        return Collections.unmodifiableList(result);
    }

    static List<String> immutable(List<String> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static ItemType keywordType(Object value) {
        if (value instanceof String || value instanceof ItemType) {
            try {
                ItemType type = ResultCoercions.ITEM_TYPE.coerce(value);
                if (type == ItemType.SETUP || type == ItemType.TEARDOWN) return type;
            } catch (IllegalArgumentException e) {
                // Falls back to KEYWORD; configuring the type then fails with the attribute error.
                return ItemType.KEYWORD;
            }
        }
        return ItemType.KEYWORD;
    }
}
