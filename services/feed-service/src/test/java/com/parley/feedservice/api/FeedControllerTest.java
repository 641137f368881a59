package com.parley.feedservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.parley.feedmodel.Message;
import com.parley.feedservice.domain.GroupService;
import com.parley.feedservice.domain.MessageService;
import com.parley.feedservice.infrastructure.web.IdentityResolver;
import com.parley.pagination.Connection;
import com.parley.pagination.CursorCodec;
import com.parley.pagination.Edge;
import com.parley.pagination.PageInfo;
import com.parley.pagination.SourceUnavailableException;
import com.parley.security.testing.TestIdentityFactory;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("FeedController")
class FeedControllerTest {

    private final MessageService messages = mock(MessageService.class);
    private final IdentityResolver identities = mock(IdentityResolver.class);
    private final FeedController controller =
            new FeedController(messages, mock(GroupService.class), identities);
    private final MockHttpServletRequest request = new MockHttpServletRequest();

    private final AtomicInteger nextChecks = new AtomicInteger();
    private final AtomicInteger previousChecks = new AtomicInteger();

    @BeforeEach
    void setUp() {
        when(identities.resolve(any())).thenReturn(TestIdentityFactory.create(1L));
        var message = new Message(7, 1, 2, "hi", Instant.EPOCH);
        var page = new Connection<>(
                List.of(new Edge<>(CursorCodec.encode(7), message)),
                PageInfo.lazy(
                        () -> nextChecks.incrementAndGet() > 0,
                        () -> previousChecks.incrementAndGet() < 0));
        when(messages.page(any(), anyLong(), any())).thenReturn(page);
    }

    @Test
    @DisplayName("resolves both flags when none are selected")
    void bothFlagsByDefault() {
        MessagePage page = controller.messages(1L, 1, null, null, null, null, request);

        assertThat(page.pageInfo()).containsEntry("hasNextPage", true).containsEntry("hasPreviousPage", false);
        assertThat(nextChecks).hasValue(1);
        assertThat(previousChecks).hasValue(1);
    }

    @Test
    @DisplayName("never evaluates an unselected flag")
    void selectedFlagOnly() {
        MessagePage page = controller.messages(1L, 1, null, null, null, List.of("hasNextPage"), request);

        assertThat(page.edges()).hasSize(1);
        assertThat(page.pageInfo()).containsOnlyKeys("hasNextPage");
        assertThat(nextChecks).hasValue(1);
        assertThat(previousChecks).hasValue(0);
    }

    @Test
    @DisplayName("an empty selection skips every flag query")
    void noFlags() {
        MessagePage page = controller.messages(1L, 1, null, null, null, List.of(), request);

        assertThat(page.pageInfo()).isEmpty();
        assertThat(nextChecks).hasValue(0);
        assertThat(previousChecks).hasValue(0);
    }

    @Test
    @DisplayName("rejects unknown flag names")
    void unknownFlag() {
        assertThatThrownBy(() -> controller.messages(1L, 1, null, null, null, List.of("hasMore"), request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hasMore");
    }

    @Test
    @DisplayName("a store failure while resolving a flag surfaces from the handler")
    void flagFailure() {
        var failing = new Connection<Message>(List.of(), PageInfo.lazy(
                () -> {
                    throw new SourceUnavailableException("exists check failed");
                },
                () -> false));
        when(messages.page(any(), anyLong(), any())).thenReturn(failing);

        assertThatThrownBy(() -> controller.messages(1L, 1, null, null, null, null, request))
                .isInstanceOf(SourceUnavailableException.class);
    }
}
