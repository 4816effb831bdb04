package com.example.bookreview.service;

import com.example.bookreview.exception.ForbiddenException;
import com.example.bookreview.security.AuthUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Owner-or-admin rule shared by reviews, comments and images.
 */
@Slf4j
@Component
public class OwnershipPolicy {

  public boolean isOwnerOrAdmin(Long ownerId, AuthUser requester) {
    return requester.isAdmin() || Objects.equals(ownerId, requester.id());
  }

  /**
   * @throws ForbiddenException with {@code deniedMessage} when the requester is neither the owner nor an admin
   */
  public void requireOwnerOrAdmin(Long ownerId, AuthUser requester, String deniedMessage) {
    if (!isOwnerOrAdmin(ownerId, requester)) {
      log.warn("User {} denied on resource owned by {}: {}", requester.id(), ownerId, deniedMessage);
      throw new ForbiddenException(deniedMessage);
    }
  }
}
