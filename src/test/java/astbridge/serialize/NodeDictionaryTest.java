package astbridge.serialize;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

public class NodeDictionaryTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final NodeDictionary dictionary = new NodeDictionary(mapper);

    @Test
    public void testEqualRecordsShareId() {
        int first = dictionary.add(List.of("integer-constant", "16"), List.of(), mapper.createObjectNode());
        int second = dictionary.add(List.of("integer-constant", "16"), List.of(), mapper.createObjectNode());
        assertEquals(first, second);
        assertEquals(1, dictionary.size());
        assertEquals(2, dictionary.getLookups());
    }

    @Test
    public void testCommaInTagDoesNotCollide() {
        int joined = dictionary.add(List.of("string-constant", "a,b"), List.of(), mapper.createObjectNode());
        int split = dictionary.add(List.of("string-constant", "a", "b"), List.of(), mapper.createObjectNode());
        assertNotEquals(joined, split);
        assertEquals(2, dictionary.size());
    }

    @Test
    public void testArgsArePartOfKey() {
        int left = dictionary.add(List.of("lval"), List.of(1, 2), mapper.createObjectNode());
        int right = dictionary.add(List.of("lval"), List.of(1, 3), mapper.createObjectNode());
        assertNotEquals(left, right);
        assertEquals(2, dictionary.toJson().size());
    }
}
