package com.tasktrack.api.todos;

import static org.assertj.core.api.Assertions.assertThat;

import com.tasktrack.api.config.TimeConfig;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaTodoStore.class, TimeConfig.class})
@DisplayName("JpaTodoStore")
class JpaTodoStoreTest {

    @Autowired private TodoStore store;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @Nested
    @DisplayName("single records")
    class SingleRecords {

        @Test
        @DisplayName("insert assigns increasing ids and defaults completed to false")
        void insert() {
            Todo first = store.insert(alice, "first", null);
            Todo second = store.insert(alice, "second", "details");

            assertThat(second.id()).isGreaterThan(first.id());
            assertThat(first.completed()).isFalse();
            assertThat(first.createdAt()).isNotNull();
            assertThat(second.description()).isEqualTo("details");
        }

        @Test
        @DisplayName("find is scoped to the owner")
        void findScoped() {
            Todo todo = store.insert(alice, "buy milk", null);

            assertThat(store.find(alice, todo.id())).isPresent();
            assertThat(store.find(bob, todo.id())).isEmpty();
        }

        @Test
        @DisplayName("update changes only supplied fields and stamps updatedAt")
        void update() {
            Todo todo = store.insert(alice, "buy milk", "2 litres");

            Todo updated = store.update(alice, todo.id(), new TodoPatch(null, null, true)).orElseThrow();

            assertThat(updated.title()).isEqualTo("buy milk");
            assertThat(updated.description()).isEqualTo("2 litres");
            assertThat(updated.completed()).isTrue();
            assertThat(updated.updatedAt()).isNotNull();
            assertThat(store.update(bob, todo.id(), new TodoPatch("x", null, null))).isEmpty();
        }

        @Test
        @DisplayName("toggle flips completion for the owner only")
        void toggle() {
            Todo todo = store.insert(alice, "buy milk", null);

            assertThat(store.toggle(alice, todo.id()).orElseThrow().completed()).isTrue();
            assertThat(store.toggle(bob, todo.id())).isEmpty();
        }

        @Test
        @DisplayName("delete removes the owner's record and ignores others")
        void delete() {
            Todo todo = store.insert(alice, "buy milk", null);

            assertThat(store.delete(bob, todo.id())).isFalse();
            assertThat(store.find(alice, todo.id())).isPresent();
            assertThat(store.delete(alice, todo.id())).isTrue();
            assertThat(store.find(alice, todo.id())).isEmpty();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("findAll keeps insertion order and owner scope")
        void findAll() {
            store.insert(alice, "one", null);
            store.insert(bob, "bob's", null);
            store.insert(alice, "two", null);

            assertThat(store.findAll(alice)).extracting(Todo::title).containsExactly("one", "two");
        }

        @Test
        @DisplayName("search matches title or description case-insensitively")
        void searchText() {
            store.insert(alice, "Buy MILK", null);
            store.insert(alice, "bake bread", "needs milk powder");
            store.insert(alice, "call mum", null);
            store.insert(bob, "milk", null);

            TodoPage page = store.search(alice, new TodoQuery(null, "milk", 1, 10));

            assertThat(page.total()).isEqualTo(2);
            assertThat(page.todos()).extracting(Todo::title).containsExactly("Buy MILK", "bake bread");
        }

        @Test
        @DisplayName("search treats LIKE wildcards literally")
        void searchWildcards() {
            store.insert(alice, "100% done", null);
            store.insert(alice, "1000 things", null);

            assertThat(store.search(alice, new TodoQuery(null, "0%", 1, 10)).todos())
                    .extracting(Todo::title).containsExactly("100% done");
        }

        @Test
        @DisplayName("search filters by completion and pages")
        void completedAndPaging() {
            for (int i = 1; i <= 5; i++) {
                Todo todo = store.insert(alice, "task " + i, null);
                if (i % 2 == 0) {
                    store.toggle(alice, todo.id());
                }
            }

            TodoPage open = store.search(alice, new TodoQuery(false, null, 1, 10));
            assertThat(open.todos()).extracting(Todo::title).containsExactly("task 1", "task 3", "task 5");

            TodoPage page2 = store.search(alice, new TodoQuery(null, null, 2, 2));
            assertThat(page2.total()).isEqualTo(5);
            assertThat(page2.todos()).extracting(Todo::title).containsExactly("task 3", "task 4");
        }
    }
}
