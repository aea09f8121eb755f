package com.harness.noti.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(long id) {
    super("Notification " + id + " not found");
  }
}
