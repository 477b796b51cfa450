package de.bsommerfeld.threadcrawler.crawler.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the API's JSON payloads onto {@link Item} and id lists. Works on the
 * {@link JsonNode} tree so that missing or unexpected fields degrade to
 * defaults instead of failing the whole item.
 */
public class ItemParser {

    /**
     * Single shared mapper. {@link ObjectMapper} is thread-safe once
     * configured.
     */
    private final ObjectMapper mapper;

    public ItemParser() {
        this(new ObjectMapper());
    }

    public ItemParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses an item body. A JSON {@code null} or empty body means the item
     * does not exist; deleted and dead items keep their child ids.
     *
     * @throws JsonProcessingException if the body is not valid JSON or not an
     *                                 object
     */
    public FetchResult parseItem(long requestedId, String body) throws JsonProcessingException {
        if (body == null || body.isBlank())
            return new FetchResult.NotFound(requestedId);

        JsonNode root = mapper.readTree(body);
        if (root == null || root.isNull() || root.isMissingNode())
            return new FetchResult.NotFound(requestedId);
        if (!root.isObject())
            throw new JsonParseFailure("Expected an item object for " + requestedId + " but got " + root.getNodeType());

        Item item = toItem(requestedId, root);
        if (item.isGone())
            return new FetchResult.NotFound(item.id(), item.kids());
        return new FetchResult.Found(item);
    }

    /**
     * Parses a listing body: a JSON array of ids. {@code null} yields an empty
     * list.
     */
    public List<Long> parseIdList(String body) throws JsonProcessingException {
        List<Long> ids = new ArrayList<>();
        if (body == null || body.isBlank())
            return ids;
        JsonNode root = mapper.readTree(body);
        if (root == null || root.isNull())
            return ids;
        if (!root.isArray())
            throw new JsonParseFailure("Expected an id array but got " + root.getNodeType());
        for (JsonNode n : root) {
            if (n.canConvertToLong())
                ids.add(n.asLong());
        }
        return ids;
    }

    private Item toItem(long requestedId, JsonNode n) {
        List<Long> kids = new ArrayList<>();
        JsonNode kidsNode = n.path("kids");
        if (kidsNode.isArray()) {
            for (JsonNode k : kidsNode) {
                if (k.canConvertToLong())
                    kids.add(k.asLong());
            }
        }
        JsonNode parent = n.path("parent");

        return new Item(
                n.path("id").asLong(requestedId),
                textOrNull(n, "type"),
                textOrNull(n, "by"),
                n.path("time").asLong(0),
                textOrNull(n, "text"),
                n.path("score").asInt(0),
                textOrNull(n, "title"),
                textOrNull(n, "url"),
                parent.canConvertToLong() ? parent.asLong() : null,
                kids,
                n.path("deleted").asBoolean(false),
                n.path("dead").asBoolean(false),
                n.path("descendants").asInt(0));
    }

    private static String textOrNull(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    /** Structurally valid JSON that does not have the expected shape. */
    static class JsonParseFailure extends JsonProcessingException {
        JsonParseFailure(String message) {
            super(message);
        }
    }
}
