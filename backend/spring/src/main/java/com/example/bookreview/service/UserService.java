package com.example.bookreview.service;

import com.example.bookreview.api.dto.ProfileUpdateReq;
import com.example.bookreview.api.dto.UserRes;
import com.example.bookreview.domain.User;
import com.example.bookreview.exception.EmailAlreadyExistsException;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.UserRepo;
import com.example.bookreview.security.AuthUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class UserService {
  private final UserRepo users;

  public UserService(UserRepo users) {
    this.users = users;
  }

  @Transactional(readOnly = true)
  public UserRes getProfile(Long userId) {
    return users.findById(userId)
        .map(UserRes::from)
        .orElseThrow(() -> new NotFoundException("User"));
  }

  /** Only name and email are editable; the role never changes here. */
  @Transactional
  public UserRes updateProfile(AuthUser requester, ProfileUpdateReq req) {
    String email = AuthService.normalizeEmail(req.email());
    if (users.existsByEmailIgnoreCaseAndIdNot(email, requester.id())) {
      throw new EmailAlreadyExistsException(EmailAlreadyExistsException.ON_PROFILE_UPDATE);
    }
    User u = users.findById(requester.id())
        .orElseThrow(() -> new NotFoundException("User"));
    u.setName(req.name().trim());
    u.setEmail(email);
    User saved = users.save(u);
    log.info("User {} updated profile", saved.getId());
    return UserRes.from(saved);
  }

  @Transactional(readOnly = true)
  public List<UserRes> listUsers() {
    return users.findAllByOrderByCreatedAtDescIdDesc().stream()
        .map(UserRes::from)
        .toList();
  }
}
