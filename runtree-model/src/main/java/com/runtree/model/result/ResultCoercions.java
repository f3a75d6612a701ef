package com.runtree.model.result;

import com.runtree.model.Coercion;
import com.runtree.model.Coercions;

import java.util.List;

final class ResultCoercions {

    static final Coercion<ItemType> ITEM_TYPE = Coercions.enumValue(ItemType.class, ItemType::fromValue);

    static final Coercion<MessageLevel> LEVEL = Coercions.enumValue(MessageLevel.class, MessageLevel::fromValue);

    static final Coercion<Tags> TAGS = Tags::coerce;

    /** Items of a nested collection: model objects or their dictionaries. */
    static final Coercion<List<?>> ITEMS = Coercions.LIST::coerce;

    /** Passes the value through; the setter accepts model objects as well as dictionaries. */
    static final Coercion<Object> AS_IS = value -> value;

    private ResultCoercions() {
    }
}
