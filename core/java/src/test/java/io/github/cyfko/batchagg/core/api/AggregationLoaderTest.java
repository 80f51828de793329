package io.github.cyfko.batchagg.core.api;

import io.github.cyfko.batchagg.core.AggregationContext;
import io.github.cyfko.batchagg.core.model.AggregateFunction;
import io.github.cyfko.batchagg.core.model.FilterChain;
import io.github.cyfko.batchagg.core.model.RelationPath;
import io.github.cyfko.batchagg.core.model.ResolvedRelationPath;
import io.github.cyfko.batchagg.core.model.ResultMapping;
import io.github.cyfko.batchagg.core.spi.BatchQueryExecutor;
import io.github.cyfko.batchagg.core.spi.PredicateResolver;
import io.github.cyfko.batchagg.core.spi.RelationMaterializer;
import io.github.cyfko.batchagg.core.spi.RelationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Batching behaviour of {@link AggregationLoader} and {@link AggregationProxy} over a
 * recording executor.
 */
@DisplayName("AggregationLoader")
class AggregationLoaderTest {

    record Author(Long id) {
    }

    record Book(Long id, int pages) {
    }

    /**
     * Executor answering from a fixed table and recording every call.
     */
    static final class RecordingExecutor implements BatchQueryExecutor {
        final List<List<Object>> calls = new ArrayList<>();
        final Map<AggregateFunction, Map<?, ?>> answers = new HashMap<>();
        RuntimeException failure;

        @Override
        public ResultMapping execute(Collection<?> parentIds, ResolvedRelationPath resolved, FilterChain chain,
                                     AggregateFunction function, String column) {
            calls.add(List.of(List.copyOf(parentIds), chain, function, column));
            if (failure != null) {
                RuntimeException e = failure;
                failure = null;
                throw e;
            }
            Map<Object, Object> values = new HashMap<Object, Object>(answers.getOrDefault(function, Map.of()));
            values.keySet().retainAll(parentIds);
            return function == AggregateFunction.EXISTS ? ResultMapping.ofKeys(values.keySet()) : ResultMapping.of(values);
        }
    }

    private static final RelationPath BOOKS = RelationPath.direct(Author.class, "books", Book.class, "author");
    private static final RelationPath REVIEWS = RelationPath.direct(Author.class, "reviews", Book.class, "reviewer");

    @Mock
    private RelationRegistry registry;

    @Mock
    private RelationMaterializer materializer;

    private RecordingExecutor executor;
    private List<Author> authors;
    private AggregationLoader<Author> loader;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(registry.identifierAttribute(any())).thenReturn("id");
        when(registry.relation(Author.class, "books")).thenReturn(BOOKS);
        when(registry.relation(Author.class, "reviews")).thenReturn(REVIEWS);
        when(registry.relation(eq(Author.class), eq("missing")))
                .thenThrow(new IllegalArgumentException("Author declares no relation 'missing'"));
        when(registry.relations(Author.class)).thenReturn(List.of(BOOKS, REVIEWS));

        executor = new RecordingExecutor();
        executor.answers.put(AggregateFunction.COUNT, Map.of(1L, 3L, 2L, 1L));
        executor.answers.put(AggregateFunction.SUM, Map.of(1L, 600L));
        executor.answers.put(AggregateFunction.MAXIMUM, Map.of(1L, 300));
        executor.answers.put(AggregateFunction.AVERAGE, Map.of(1L, 200.0));
        executor.answers.put(AggregateFunction.EXISTS, Map.of(1L, true, 2L, true));

        AggregationContext context = new AggregationContext(registry, executor, materializer,
                entity -> ((Author) entity).id());
        authors = List.of(new Author(1L), new Author(2L), new Author(3L));
        loader = context.createLoader(Author.class, authors);
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("One query per descriptor serves every parent")
        void oneQueryPerDescriptor() {
            List<Long> counts = new ArrayList<>();
            for (Author author : authors) {
                counts.add(loader.<Book>proxyFor(author, "books").count());
            }

            assertEquals(List.of(3L, 1L, 0L), counts);
            assertEquals(1, executor.calls.size());
            assertEquals(List.of(1L, 2L, 3L), executor.calls.get(0).get(0));
            assertEquals(1, loader.cacheSize());
        }

        @Test
        @DisplayName("Equal chains built on different parents share the query")
        void equalChainsShare() {
            for (Author author : authors) {
                loader.<Book>proxyFor(author, "books").where("genre", "sf").greaterThan("pages", 100).count();
            }
            loader.<Book>proxyFor(authors.get(0), "books").greaterThan("pages", 100).where("genre", "sf").count();

            assertEquals(2, executor.calls.size());
            assertEquals(2, loader.cacheSize());
        }

        @Test
        @DisplayName("Functions, columns and relations each get their own query")
        void distinctDescriptors() {
            Author first = authors.get(0);
            loader.<Book>proxyFor(first, "books").count();
            loader.<Book>proxyFor(first, "books").count("pages");
            loader.<Book>proxyFor(first, "books").sum("pages");
            loader.<Book>proxyFor(first, "reviews").count();

            assertEquals(4, executor.calls.size());
        }

        @Test
        @DisplayName("Absent parents get the function's default")
        void absenceDefaults() {
            Author third = authors.get(2);
            AggregationProxy<Book> books = loader.proxyFor(third, "books");

            assertEquals(0L, books.count());
            assertEquals(0L, books.sum("pages").longValue());
            assertEquals(Optional.empty(), books.average("pages"));
            assertEquals(Optional.empty(), books.maximum("pages"));
            assertEquals(Optional.empty(), books.minimum("pages"));
            assertFalse(books.exists());
        }

        @Test
        @DisplayName("Present parents get their value")
        void presentValues() {
            AggregationProxy<Book> books = loader.proxyFor(authors.get(0), "books");

            assertEquals(600L, books.sum("pages").longValue());
            assertEquals(Optional.of(200.0), books.average("pages"));
            assertEquals(Optional.of(300), books.<Integer>maximum("pages"));
            assertTrue(books.exists());
        }

        @Test
        @DisplayName("A failed query is retried by the next request")
        void failureNotCached() {
            executor.failure = new IllegalStateException("connection reset");
            AggregationProxy<Book> books = loader.proxyFor(authors.get(0), "books");

            assertThrows(IllegalStateException.class, books::count);
            assertEquals(0, loader.cacheSize());

            assertEquals(3L, books.count());
            assertEquals(2, executor.calls.size());
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class Fallbacks {

        @Test
        @DisplayName("Blocks are evaluated for their own parent only, uncached")
        void blockChains() {
            PredicateResolver<Book> block = (root, query, cb) -> cb.conjunction();

            for (Author author : authors) {
                loader.<Book>proxyFor(author, "books").where(block).count();
            }

            assertEquals(3, executor.calls.size());
            assertEquals(List.of(1L), executor.calls.get(0).get(0));
            assertEquals(List.of(3L), executor.calls.get(2).get(0));
            assertEquals(0, loader.cacheSize());
        }

        @Test
        @DisplayName("Per-row blocks load the rows of the parent")
        void rowBlocks() {
            Author first = authors.get(0);
            List<Book> books = List.of(new Book(10L, 120), new Book(11L, 480));
            when(materializer.<Book>load(eq(1L), any(), any())).thenReturn(books);

            AggregationProxy<Book> proxy = loader.proxyFor(first, "books");

            assertEquals(1L, proxy.count(book -> book.pages() > 200));
            assertEquals(600.0, proxy.sum(Book::pages));
            assertEquals(Optional.of(480), proxy.maximum(Book::pages));
            assertTrue(proxy.exists(book -> book.pages() == 120));
            assertEquals(0, executor.calls.size());
        }

        @Test
        @DisplayName("Enumeration passes the recorded chain to the materializer")
        void enumeration() {
            when(materializer.<Book>load(any(), any(), any())).thenReturn(List.of(new Book(10L, 120)));

            List<Book> rows = loader.<Book>proxyFor(authors.get(1), "books").orderBy("pages").toList();

            assertEquals(1, rows.size());
            verify(materializer).load(eq(2L), any(ResolvedRelationPath.class),
                    eq(FilterChain.empty().append("orderBy", "pages")));
        }
    }

    @Nested
    @DisplayName("Proxies")
    class Proxies {

        @Test
        @DisplayName("Chaining does not mutate the original proxy")
        void immutableChaining() {
            AggregationProxy<Book> base = loader.proxyFor(authors.get(0), "books");
            AggregationProxy<Book> filtered = base.where("genre", "sf");

            assertTrue(base.filterChain().isEmpty());
            assertEquals(1, filtered.filterChain().size());
        }

        @Test
        @DisplayName("whereIn keeps null members and compares by content")
        void whereInWithNull() {
            AggregationProxy<Book> base = loader.proxyFor(authors.get(0), "books");

            AggregationProxy<Book> filtered = base.whereIn("genre", Arrays.asList("sf", null));

            assertEquals(Arrays.asList("sf", null), filtered.filterChain().steps().get(0).argument(1));
            assertEquals(filtered.filterChain(),
                    base.whereIn("genre", new LinkedHashSet<>(Arrays.asList("sf", null))).filterChain());
        }

        @Test
        @DisplayName("proxiesFor exposes every relation in declaration order")
        void proxiesFor() {
            Map<String, AggregationProxy<?>> proxies = loader.proxiesFor(authors.get(0));

            assertEquals(List.of("books", "reviews"), new ArrayList<>(proxies.keySet()));
        }

        @Test
        @DisplayName("Parents outside the batch are rejected")
        void foreignParent() {
            assertThrows(IllegalArgumentException.class, () -> loader.proxyFor(new Author(99L), "books"));
        }

        @Test
        @DisplayName("Unknown relations are rejected")
        void unknownRelation() {
            assertThrows(IllegalArgumentException.class, () -> loader.proxyFor(authors.get(0), "missing"));
        }

        @Test
        @DisplayName("A typed proxy checks the target type")
        void typedProxy() {
            assertNotNull(loader.proxyFor(authors.get(0), "books", Book.class));
            assertThrows(IllegalArgumentException.class, () -> loader.proxyFor(authors.get(0), "books", String.class));
        }

        @Test
        @DisplayName("invoke dispatches aggregates, deferred aggregates and chain steps")
        void invoke() {
            AggregationProxy<Book> books = loader.proxyFor(authors.get(0), "books");

            assertEquals(3L, books.invoke("count"));
            assertEquals(600L, books.invoke("sum", "pages"));

            Object deferred = books.invoke("async_exists");
            assertInstanceOf(DeferredValue.class, deferred);
            assertEquals(true, ((DeferredValue<?>) deferred).value());

            Object chained = books.invoke("published");
            assertInstanceOf(AggregationProxy.class, chained);
            assertEquals(FilterChain.empty().append("published"), ((AggregationProxy<?>) chained).filterChain());

            assertThrows(IllegalArgumentException.class, () -> books.invoke("sum", 42));
        }

        @Test
        @DisplayName("Deferred values run nothing until resolved")
        void deferred() {
            DeferredValue<Long> count = loader.<Book>proxyFor(authors.get(0), "books").asyncCount();
            DeferredValue<Boolean> exists = loader.<Book>proxyFor(authors.get(1), "books").asyncExists();

            assertEquals(0, executor.calls.size());
            loader.resolveAll(count, exists);

            assertEquals(2, executor.calls.size());
            assertEquals(3L, count.value().longValue());
            assertTrue(exists.value());
            assertEquals(2, executor.calls.size());
        }
    }
}
