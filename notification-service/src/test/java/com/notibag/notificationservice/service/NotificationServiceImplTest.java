package com.notibag.notificationservice.service;

import com.notibag.common.exception.ResourceNotFoundException;
import com.notibag.notificationservice.model.ListScope;
import com.notibag.notificationservice.model.Notification;
import com.notibag.notificationservice.repository.NotificationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-10-19T09:30:00.123Z");

    @Mock
    private NotificationStore notificationStore;

    private NotificationServiceImpl notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationServiceImpl(
                notificationStore, new NotificationIdGenerator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void create_ValidInput_StoresUnreadNotificationStampedNow() {
        // Act
        Notification created = notificationService.create("Build done", "Target X compiled");

        // Assert
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationStore).insert(captor.capture());

        Notification stored = captor.getValue();
        assertThat(stored).isEqualTo(created);
        assertThat(stored.getId()).isEqualTo("20261019093000-123");
        assertThat(stored.getTitle()).isEqualTo("Build done");
        assertThat(stored.getMessage()).isEqualTo("Target X compiled");
        assertThat(stored.getTimestamp()).isEqualTo(NOW);
        assertThat(stored.isRead()).isFalse();
    }

    @Test
    void create_SameTick_GeneratesDistinctIds() {
        Notification first = notificationService.create("a", "b");
        Notification second = notificationService.create("a", "b");

        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    void create_EmptyTitle_ThrowsAndStoresNothing() {
        assertThatThrownBy(() -> notificationService.create("", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("title");

        verify(notificationStore, never()).insert(any());
    }

    @Test
    void create_EmptyMessage_ThrowsAndStoresNothing() {
        assertThatThrownBy(() -> notificationService.create("x", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("message");

        verify(notificationStore, never()).insert(any());
    }

    @Test
    void create_WhitespaceOnlyOrNullFields_Throws() {
        assertThatThrownBy(() -> notificationService.create("   ", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> notificationService.create("x", "\t\n"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> notificationService.create(null, "x"))
                .isInstanceOf(IllegalArgumentException.class);

        verify(notificationStore, never()).insert(any());
    }

    @Test
    void markRead_BlankId_ThrowsWithoutTouchingStore() {
        assertThatThrownBy(() -> notificationService.markRead(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ID is required");
        assertThatThrownBy(() -> notificationService.markRead(null))
                .isInstanceOf(IllegalArgumentException.class);

        verify(notificationStore, never()).markRead(anyString());
    }

    @Test
    void markRead_UnknownId_PropagatesNotFoundUnchanged() {
        ResourceNotFoundException notFound = new ResourceNotFoundException("Notification not found: unknown");
        doThrow(notFound).when(notificationStore).markRead("unknown");

        assertThatThrownBy(() -> notificationService.markRead("unknown")).isSameAs(notFound);
    }

    @Test
    void markRead_ExistingId_DelegatesToStore() {
        notificationService.markRead("20261019093000-123");

        verify(notificationStore).markRead("20261019093000-123");
    }

    @Test
    void listUnread_ReturnsStoreUnreadListingUnchanged() {
        List<Notification> unread = List.of(Notification.builder().id("2").build(), Notification.builder().id("1").build());
        when(notificationStore.list(ListScope.UNREAD_ONLY)).thenReturn(unread);

        assertThat(notificationService.listUnread()).isSameAs(unread);
    }

    @Test
    void listAll_ReturnsFullStoreListing() {
        List<Notification> all = List.of(Notification.builder().id("1").read(true).build());
        when(notificationStore.list(ListScope.ALL)).thenReturn(all);

        assertThat(notificationService.listAll()).isSameAs(all);
    }

    @Test
    void clearAll_DelegatesToStore() {
        notificationService.clearAll();

        verify(notificationStore).clear();
    }
}
