package com.quill.content.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quill.content.domain.ContentException;
import com.quill.content.domain.ErrorKind;
import com.quill.content.domain.NewUser;
import com.quill.content.domain.PostPatch;
import com.quill.content.domain.User;
import com.quill.content.infrastructure.memory.InMemoryPostStore;
import com.quill.content.infrastructure.memory.InMemoryUserStore;
import com.quill.observability.MetricFactory;
import com.quill.security.CallerIdentity;
import com.quill.security.HashRecord;
import com.quill.security.OwnershipViolationException;
import com.quill.security.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PostService")
class PostServiceTest {

    private static final HashRecord HASH = new HashRecord("$2a$04$not-a-real-digest");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private PostService service;
    private User alice;
    private User bob;
    private CallerIdentity asAlice;
    private CallerIdentity asBob;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        var users = new InMemoryUserStore(clock);
        registry = new SimpleMeterRegistry();
        service = new PostService(
                new InMemoryPostStore(clock), users, new MetricFactory(registry, "quill-test"));
        alice = users.create(new NewUser("Alice", "a@x.com", HASH)).value();
        bob = users.create(new NewUser("Bob", "b@x.com", HASH)).value();
        asAlice = new CallerIdentity(alice.id());
        asBob = new CallerIdentity(bob.id());
    }

    @Test
    @DisplayName("create fixes the owner to the caller and attaches the author")
    void create() {
        AuthoredPost created = service.create(asAlice, "Hi", "World");

        assertThat(created.post().ownerId()).isEqualTo(alice.id());
        assertThat(created.author()).isEqualTo(alice);
    }

    @Test
    @DisplayName("list is public and includes every owner's posts with their authors")
    void listIncludesEveryone() {
        service.create(asAlice, "a", "1");
        clock.advance(Duration.ofSeconds(1));
        service.create(asBob, "b", "2");

        assertThat(service.list())
                .extracting(p -> p.author().name())
                .containsExactly("Bob", "Alice");
    }

    @Test
    @DisplayName("listByOwner returns only the caller's posts")
    void listMine() {
        service.create(asAlice, "a", "1");
        service.create(asBob, "b", "2");

        assertThat(service.listByOwner(asAlice, alice.id()))
                .extracting(p -> p.post().title())
                .containsExactly("a");
    }

    @Test
    @DisplayName("listByOwner for someone else's id is an ownership violation")
    void listSomeoneElses() {
        assertThatThrownBy(() -> service.listByOwner(asBob, alice.id()))
                .isInstanceOf(OwnershipViolationException.class);
    }

    @Test
    @DisplayName("get of an unknown id is NotFound")
    void getMissing() {
        assertThatThrownBy(() -> service.get(UUID.randomUUID()))
                .isInstanceOfSatisfying(ContentException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND);
                    assertThat(e.getMessage()).isEqualTo("Post not found");
                });
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        @DisplayName("owner may update and delete")
        void ownerWrites() {
            UUID id = service.create(asAlice, "Hi", "World").post().id();

            assertThat(service.update(asAlice, id, new PostPatch(null, "Everyone")).post().body())
                    .isEqualTo("Everyone");
            service.delete(asAlice, id);

            assertThatThrownBy(() -> service.get(id)).isInstanceOf(ContentException.class);
        }

        @Test
        @DisplayName("another user gets Forbidden on update and delete")
        void strangerForbidden() {
            UUID id = service.create(asAlice, "Hi", "World").post().id();

            assertThatThrownBy(() -> service.update(asBob, id, new PostPatch("x", null)))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.FORBIDDEN));
            assertThatThrownBy(() -> service.delete(asBob, id))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.FORBIDDEN));
            assertThat(service.get(id).post().title()).isEqualTo("Hi");
            assertThat(registry.find(PostService.METRIC_POST_WRITES)
                    .tag(MetricFactory.TAG_OUTCOME, "forbidden").counters()).hasSize(2);
        }

        @Test
        @DisplayName("a missing post is NotFound before any ownership check")
        void notFoundFirst() {
            assertThatThrownBy(() -> service.update(asBob, UUID.randomUUID(), new PostPatch("x", null)))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
            assertThatThrownBy(() -> service.delete(asBob, UUID.randomUUID()))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        }

        @Test
        @DisplayName("an empty update returns the post untouched and still checks the owner")
        void emptyUpdate() {
            var created = service.create(asAlice, "Hi", "World").post();
            clock.advance(Duration.ofMinutes(5));

            var unchanged = service.update(asAlice, created.id(), new PostPatch(null, null));

            assertThat(unchanged.post()).isEqualTo(created);
            assertThat(unchanged.post().updatedAt()).isEqualTo(created.updatedAt());
            assertThat(unchanged.author().name()).isEqualTo("Alice");
            assertThatThrownBy(() -> service.update(asBob, created.id(), new PostPatch(null, null)))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.FORBIDDEN));
            assertThatThrownBy(() -> service.update(asAlice, UUID.randomUUID(), new PostPatch(null, null)))
                    .isInstanceOfSatisfying(ContentException.class,
                            e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        }
    }
}
