package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.ModelJson;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named GROUP block.
 */
public final class Group extends StatusItem<Group> {

    private static final AttributeTable<Group> ATTRIBUTES = bodyAttribute(statusAttributes(
            AttributeTable.<Group>builder("Group")
                    .readOnly("type", Group::getType, ResultCoercions.ITEM_TYPE)
                    .add("name", Group::getName, Group::setName, Coercions.STRING),
            true)).build();

    private String name = "";

    public Group() {
        super(Body.STEPS);
    }

    public static Group fromDict(Map<String, ?> data) {
        return fromDict(Group::new, data);
    }

    public static Group fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Group fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Group> attributeTable() {
        return ATTRIBUTES;
    }

    @Override
    public ItemType getType() {
        return ItemType.GROUP;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = startDict(new LinkedHashMap<>());
        data.put("name", name);
        return finishDict(data);
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("name");
    }
}
