import io.github.flameyossnowy.kvmodels.api.ModelManager;
import io.github.flameyossnowy.kvmodels.api.ModelRepository;
import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.Fields;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.Query;
import io.github.flameyossnowy.kvmodels.api.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RelationTest {
    private static final ModelSchema BOT = ModelSchema.builder("Bot")
        .field("name", Fields.string())
        .build();

    private static final ModelSchema BOT_SESSION = ModelSchema.builder("BotSession")
        .field("token", Fields.string())
        .field("bot", Fields.reference("Bot"))
        .build();

    private static final ModelSchema TASK = ModelSchema.builder("Task")
        .field("status", Fields.string())
        .field("session", Fields.reference("BotSession"))
        .build();

    private static final ModelSchema TAG = ModelSchema.builder("Tag")
        .field("label", Fields.string())
        .build();

    private static final ModelSchema POST = ModelSchema.builder("Post")
        .field("title", Fields.string())
        .field("tags", Fields.references("Tag"))
        .build();

    ModelManager manager;
    ModelRepository bots;
    ModelRepository botSessions;
    ModelRepository tasks;
    ModelRepository tags;
    ModelRepository posts;

    @BeforeEach
    void setup() {
        manager = ModelManager.builder()
            .withStore(new InMemoryKeyValueStore())
            .withPrefix("rel")
            .withLenientDeserialization(false)
            .build();
        List<ModelRepository> repositories = manager.register(TASK, BOT_SESSION, BOT, POST, TAG);
        tasks = repositories.get(0);
        botSessions = repositories.get(1);
        bots = repositories.get(2);
        posts = repositories.get(3);
        tags = repositories.get(4);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void referenceResolvesToTheTargetInstance() {
        ModelInstance bot = bots.create(Map.of("name", "helper"));
        ModelInstance session = botSessions.create(Map.of("token", "t1", "bot", bot));

        ModelInstance loaded = botSessions.findById(session.getId()).orElseThrow();
        ModelInstance loadedBot = loaded.get("bot", ModelInstance.class);
        assertNotNull(loadedBot);
        assertEquals("helper", loadedBot.get("name"));
        assertEquals(bot.getId(), loadedBot.getId());
        assertEquals(loadedBot, session.get("bot"));
    }

    @Test
    void referenceAcceptsBareIds() {
        ModelInstance bot = bots.create(Map.of("name", "helper"));
        ModelInstance session = botSessions.create(Map.of("token", "t1", "bot", bot.getId()));

        assertEquals("helper", session.get("bot", ModelInstance.class).get("name"));
    }

    @Test
    void referenceToMissingRecordIsRejectedOnSave() {
        assertThrows(ValidationException.class, () -> botSessions.create(Map.of("token", "t1", "bot", 42L)));
        assertEquals(0, botSessions.count());
    }

    @Test
    void filterThroughReferences() {
        ModelInstance helper = bots.create(Map.of("name", "helper"));
        ModelInstance other = bots.create(Map.of("name", "other"));
        ModelInstance s1 = botSessions.create(Map.of("token", "t1", "bot", helper));
        ModelInstance s2 = botSessions.create(Map.of("token", "t2", "bot", other));
        tasks.create(Map.of("status", "ok", "session", s1));
        tasks.create(Map.of("status", "ok", "session", s2));
        tasks.create(Map.of("status", "fail"));

        assertEquals(1, botSessions.filter(Map.of("bot__name", "helper")).count());
        assertEquals(1, botSessions.filter(Map.of("bot", helper)).count());
        assertEquals(1, botSessions.filter(Map.of("bot", other.getId())).count());

        List<ModelInstance> viaNested = tasks.query(Query.select().where("session", "bot", "name").iexact("HELPER").build()).asList();
        assertEquals(1, viaNested.size());
        assertEquals(s1.getId(), viaNested.get(0).get("session", ModelInstance.class).getId());

        assertEquals(1, tasks.filter(Map.of("session__isnull", true)).count());
        assertEquals(1, tasks.filter(Map.of("session__bot__name__isnull", true)).count());
        assertEquals(0, tasks.filter(Map.of("session__bot__name", "nobody")).count());
        assertEquals(0, tasks.query(Query.select().where("session", "bot", "name").eq(null).build()).count());
    }

    @Test
    void nestedFilterOnUnknownFieldFails() {
        assertThrows(ValidationException.class, () -> tasks.filter(Map.of("session__bot__nope", 1)));
        assertThrows(ValidationException.class, () -> tasks.filter(Map.of("status__name", 1)));
    }

    @Test
    void deletingTheTargetBreaksTheReferenceWithoutCascade() {
        ModelInstance bot = bots.create(Map.of("name", "helper"));
        botSessions.create(Map.of("token", "t1", "bot", bot));

        bots.delete(bot);

        assertEquals(1, botSessions.count());
        ValidationException e = assertThrows(ValidationException.class, () -> botSessions.query());
        assertEquals("BotSession", e.getModelName());
        assertEquals("bot", e.getFieldName());
    }

    @Test
    void manyToManyStoresAndResolvesIdLists() {
        ModelInstance java = tags.create(Map.of("label", "java"));
        ModelInstance redis = tags.create(Map.of("label", "redis"));
        ModelInstance post = posts.create(Map.of("title", "hello", "tags", List.of(java, redis)));

        @SuppressWarnings("unchecked")
        List<ModelInstance> loaded = (List<ModelInstance>) posts.findById(post.getId()).orElseThrow().get("tags");
        assertNotNull(loaded);
        Set<Object> labels = loaded.stream().map(tag -> tag.get("label")).collect(Collectors.toSet());
        assertEquals(Set.of("java", "redis"), labels);

        assertEquals(1, posts.filter(Map.of("tags__label", "redis")).count());
        assertEquals(1, posts.filter(Map.of("tags__contains", java)).count());
        assertEquals(0, posts.filter(Map.of("tags__label", "go")).count());
    }

    @Test
    void manyToManySkipsDeletedTargetsAndKeepsEmptyLists() {
        ModelInstance java = tags.create(Map.of("label", "java"));
        ModelInstance redis = tags.create(Map.of("label", "redis"));
        ModelInstance post = posts.create(Map.of("title", "hello", "tags", List.of(java, redis)));
        ModelInstance empty = posts.create(Map.of("title", "empty", "tags", List.of()));

        tags.delete(redis);

        assertEquals(1, ((List<?>) posts.findById(post.getId()).orElseThrow().get("tags")).size());
        assertEquals(List.of(), posts.findById(empty.getId()).orElseThrow().get("tags"));
    }

    @Test
    void referenceCyclesTerminate() {
        ModelSchema left = ModelSchema.builder("Left").field("right", Fields.reference("Right")).build();
        ModelSchema right = ModelSchema.builder("Right").field("left", Fields.reference("Left")).build();
        List<ModelRepository> repositories = manager.register(left, right);
        ModelRepository lefts = repositories.get(0);
        ModelRepository rights = repositories.get(1);

        ModelInstance l = lefts.create(Map.of());
        ModelInstance r = rights.create(Map.of("left", l));
        lefts.update(l, Map.of("right", r));

        ModelInstance loaded = lefts.query().first().orElseThrow();
        ModelInstance loadedRight = loaded.get("right", ModelInstance.class);
        assertEquals(r.getId(), loadedRight.getId());
        assertEquals(l.getId(), loadedRight.get("left", ModelInstance.class).getId());

        ModelInstance reloaded = lefts.query().first().orElseThrow();
        assertEquals(loaded, reloaded);
        assertEquals(loaded.hashCode(), reloaded.hashCode());
        assertEquals("Left{id=" + l.getId() + ", right=Right#" + r.getId() + "}", loaded.toString());
        assertTrue(loadedRight.toString().contains("left=Left#" + l.getId()));
    }
}
