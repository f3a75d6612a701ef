package com.runtree.model.result;

import com.runtree.model.DataException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BodyTest {

    @Test
    void createBranch_defaultTypeDependsOnOwner() {
        assertEquals(ItemType.IF, new If().getBody().createBranch().getType());
        assertEquals(ItemType.TRY, new Try().getBody().createBranch().getType());
        assertEquals(ItemType.EXCEPT, new Try().getBody().createBranch(Map.of("type", "EXCEPT")).getType());
    }

    @Test
    void create_rejectsTypesTheOwnerDoesNotAllow() {
        DataException e = assertThrows(DataException.class, () -> new For().getBody().createVar());
        assertEquals("'For' body does not allow type 'VAR'.", e.getMessage());
        assertThrows(DataException.class, () -> new If().getBody().createBranch(Map.of("type", "EXCEPT")));
        assertThrows(DataException.class, () -> new Var().getBody().createFor());
    }

    @Test
    void createFromDict_dispatchesOnType() {
        Body body = new TestCase("T").getBody();
        assertInstanceOf(Keyword.class, body.createFromDict(Map.of("name", "No type")));
        assertInstanceOf(For.class, body.createFromDict(Map.of("type", "FOR")));
        assertInstanceOf(If.class, body.createFromDict(Map.of("type", "IF/ELSE ROOT")));
        assertInstanceOf(ErrorItem.class, body.createFromDict(Map.of("type", "ERROR")));
        assertInstanceOf(Message.class, body.createFromDict(Map.of("type", "MESSAGE", "message", "m")));
        assertEquals(5, body.size());
    }

    @Test
    void createFromDict_rejectsUnknownAndFixtureTypes() {
        Body body = new TestCase("T").getBody();
        assertThrows(DataException.class, () -> body.createFromDict(Map.of("type", "BOGUS")));
        assertThrows(DataException.class, () -> body.createFromDict(Map.of("type", "SETUP")));
    }

    @Test
    void replaceWith_acceptsItemsAndDictionaries() {
        TestCase test = new TestCase("T");
        Keyword existing = new Keyword().config("name", "Existing");
        test.setBody(List.of(existing, Map.of("type", "RETURN", "values", List.of("x"))));

        assertEquals(2, test.getBody().size());
        assertSame(existing, test.getBody().get(0));
        assertSame(test, existing.getParent());
        assertEquals(List.of("x"), ((Return) test.getBody().get(1)).getValues());
        assertThrows(DataException.class, () -> test.setBody(List.of("not an item")));
    }

    @Test
    void stepsAndMessagesAreSeparated() {
        Keyword kw = new Keyword();
        kw.getBody().createMessage(Map.of("message", "first"));
        kw.getBody().createKeyword();
        kw.getBody().createMessage(Map.of("message", "second"));
        assertEquals(1, kw.getSteps().size());
        assertEquals(2, kw.getMessages().size());
        assertEquals("k1-m2", kw.getMessages().get(1).getId());
    }
}
