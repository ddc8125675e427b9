package com.openforge.lexguard.auth;

import com.openforge.lexguard.auth.dto.AuthResponse;
import com.openforge.lexguard.auth.dto.LoginRequest;
import com.openforge.lexguard.auth.dto.RegisterRequest;
import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Register and login. Suspended and banned accounts can still log in: they
 * need a session to see their status and to appeal. Posting is blocked by
 * GateCheck, not here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository  userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil         jwtUtil;
    private final Clock           clock;

    @Transactional
    public AuthResponse register(RegisterRequest req) {
        if (userRepository.existsByUsername(req.username())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Username already taken");
        }
        if (req.email() != null && !req.email().isBlank() && userRepository.existsByEmail(req.email())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Email already in use");
        }

        User user = new User();
        user.setUsername(req.username());
        user.setEmail(normalize(req.email()));
        user.setDisplayName(req.displayName() == null || req.displayName().isBlank()
                ? req.username()
                : req.displayName());
        user.setPasswordHash(passwordEncoder.encode(req.password()));

        User saved = userRepository.save(user);
        log.info("[Auth] New user registered: id={}", saved.getId());

        return toResponse(saved);
    }

    @Transactional
    public AuthResponse login(LoginRequest req) {
        User user = userRepository
                .findByUsernameOrEmail(req.identifier(), req.identifier())
                .filter(u -> passwordEncoder.matches(req.password(), u.getPasswordHash()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials"));

        user.setLastLoginTime(LocalDateTime.now(clock));
        log.debug("[Auth] Login id={} status={}", user.getId(), user.getAccountStatus());
        return toResponse(user);
    }

    private AuthResponse toResponse(User user) {
        String token = jwtUtil.generate(user.getId(), user.getUsername(), user.getRole());
        return new AuthResponse(user.getId(), user.getUsername(), user.getDisplayName(),
                user.getRole(), user.getAccountStatus(), token);
    }

    private String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
