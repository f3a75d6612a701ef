package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One round of a FOR or WHILE loop. FOR iterations map each loop variable to its value;
 * WHILE iterations have no assignment.
 */
public final class Iteration extends StatusItem<Iteration> {

    private static final AttributeTable<Iteration> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Iteration>builder("Iteration")
                    .readOnly("type", Iteration::getType, ResultCoercions.ITEM_TYPE)
                    .add("assign", Iteration::getAssign, Iteration::setAssign, Coercions.STRING_MAP),
            true)).build();

    private Map<String, String> assign = new LinkedHashMap<>();

    public Iteration() {
        super(Body.STEPS);
    }

    public static Iteration fromDict(Map<String, ?> data) {
        return fromDict(Iteration::new, data);
    }

    public static Iteration fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Iteration fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Iteration> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.ITERATION;
    }

    /** Loop variable to value, in loop variable order. Mutable. */
    public Map<String, String> getAssign() {
        return assign;
    }

    public void setAssign(Map<String, String> assign) {
        this.assign = assign != null ? new LinkedHashMap<>(assign) : new LinkedHashMap<>();
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        assign = new LinkedHashMap<>(assign);
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        if (!assign.isEmpty()) data.put("assign", new LinkedHashMap<>(assign));
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("assign");
    }
}
