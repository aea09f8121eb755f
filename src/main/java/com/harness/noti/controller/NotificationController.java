package com.harness.noti.controller;

import com.harness.noti.model.NotificationRecord;
import com.harness.noti.model.NotificationRequest;
import com.harness.noti.model.NotificationView;
import com.harness.noti.service.NotificationCommandService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/guilds/{guildId}/notifications")
@Validated
public class NotificationController {

  private static final String USER_HEADER = "X-User-Id";
  private static final String MANAGE_HEADER = "X-Manage-Messages";

  private final NotificationCommandService commandService;

  public NotificationController(NotificationCommandService commandService) {
    this.commandService = commandService;
  }

  @PostMapping
  public ResponseEntity<NotificationRecord> addNotification(
      @PathVariable long guildId,
      @RequestHeader(USER_HEADER) long userId,
      @Valid @RequestBody NotificationRequest request) {
    NotificationRecord created = commandService.add(guildId, userId, request);
    return ResponseEntity
        .created(URI.create("/api/v1/guilds/" + guildId + "/notifications/" + created.id()))
        .body(created);
  }

  @GetMapping
  public ResponseEntity<List<NotificationView>> listNotifications(@PathVariable long guildId) {
    return ResponseEntity.ok(commandService.list(guildId));
  }

  @DeleteMapping("/{notificationId}")
  public ResponseEntity<Void> deleteNotification(
      @PathVariable long guildId,
      @PathVariable long notificationId,
      @RequestHeader(USER_HEADER) long userId,
      @RequestHeader(value = MANAGE_HEADER, defaultValue = "false") boolean canManageMessages) {
    commandService.delete(guildId, notificationId, userId, canManageMessages);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping
  public ResponseEntity<DeleteAllResponse> deleteAllNotifications(
      @PathVariable long guildId,
      @RequestHeader(USER_HEADER) long userId) {
    return ResponseEntity.ok(new DeleteAllResponse(commandService.deleteAll(guildId, userId)));
  }

  public record DeleteAllResponse(int deleted) {}
}
