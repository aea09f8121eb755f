package com.harness.noti.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class DeletionNotAllowedException extends RuntimeException {

  public DeletionNotAllowedException(long id, long userId) {
    super("User " + userId + " may not delete notification " + id);
  }
}
