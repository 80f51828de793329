package io.github.cyfko.batchagg.jpa.relation;

import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.FilterStep;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.jpa.entities.Category;
import io.github.cyfko.batchagg.jpa.entities.Comment;
import io.github.cyfko.batchagg.jpa.entities.Label;
import io.github.cyfko.batchagg.jpa.entities.Post;
import io.github.cyfko.batchagg.jpa.entities.PostCategory;
import io.github.cyfko.batchagg.jpa.entities.Tag;
import io.github.cyfko.batchagg.jpa.entities.User;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JpaRelationRegistry")
class JpaRelationRegistryTest {

    private static EntityManagerFactory emf;
    private JpaRelationRegistry registry;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void createRegistry() {
        registry = new JpaRelationRegistry(emf.getMetamodel());
    }

    @Test
    @DisplayName("mappedBy one-to-many is a direct relation on the inverse attribute")
    void directRelation() {
        RelationPath posts = registry.relation(User.class, "posts");

        assertFalse(posts.isThrough());
        assertEquals(Post.class, posts.targetType());
        assertEquals("author", posts.foreignKey());
        assertTrue(posts.scope().isEmpty());
    }

    @Test
    @DisplayName("@Scoped adds the named scopes as the relation's built-in chain")
    void scopedRelation() {
        RelationPath published = registry.relation(User.class, "publishedPosts");

        assertEquals(FilterChain.of(FilterStep.of("published")), published.scope());
    }

    @Test
    @DisplayName("Many-to-many is a through relation whose intermediate is the owner")
    void manyToMany() {
        RelationPath tags = registry.relation(Post.class, "tags");

        assertTrue(tags.isThrough());
        assertEquals(Tag.class, tags.targetType());
        assertEquals(Post.class, tags.throughHop().orElseThrow().intermediateType());
        assertEquals("id", tags.throughHop().orElseThrow().parentKey());
    }

    @Test
    @DisplayName("@Through goes through the intermediate entity of another relation")
    void throughAnnotation() {
        RelationPath categories = registry.relation(Post.class, "categories");

        assertTrue(categories.isThrough());
        assertEquals(Category.class, categories.targetType());
        assertEquals(PostCategory.class, categories.throughHop().orElseThrow().intermediateType());
        assertEquals("post.id", categories.throughHop().orElseThrow().parentKey());
    }

    @Test
    @DisplayName("Relations are listed in declaration order")
    void relationsInOrder() {
        List<String> names = registry.relations(User.class).stream()
                .map(RelationPath::name)
                .collect(Collectors.toList());

        assertEquals(List.of("posts", "publishedPosts", "comments", "tags", "labels"), names);
        assertTrue(registry.relations(Label.class).isEmpty());
    }

    @Test
    @DisplayName("Associations are found by target type, persistent ones only")
    void findAssociation() {
        assertEquals("postCategories", registry.findAssociation(Category.class, PostCategory.class).orElseThrow());
        assertEquals("posts", registry.findAssociation(Tag.class, Post.class).orElseThrow());
        assertEquals("author", registry.findAssociation(Post.class, User.class).orElseThrow());
        assertTrue(registry.findAssociation(Label.class, Comment.class).isEmpty());
        // Post.categories is @Transient
        assertTrue(registry.findAssociation(Post.class, Category.class).isEmpty());
    }

    @Test
    @DisplayName("Identifier attribute comes from the metamodel")
    void identifierAttribute() {
        assertEquals("id", registry.identifierAttribute(User.class));
        assertEquals("id", registry.identifierAttribute(PostCategory.class));
    }

    @Test
    @DisplayName("Unknown relations and non-entities are rejected")
    void rejections() {
        assertThrows(IllegalArgumentException.class, () -> registry.relation(User.class, "followers"));
        assertThrows(IllegalArgumentException.class, () -> registry.relation(String.class, "value"));
    }
}
