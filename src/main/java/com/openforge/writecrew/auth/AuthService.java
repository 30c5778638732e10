package com.openforge.writecrew.auth;

import com.openforge.writecrew.auth.dto.AuthResponse;
import com.openforge.writecrew.auth.dto.LoginRequest;
import com.openforge.writecrew.auth.dto.RegisterRequest;
import com.openforge.writecrew.domain.User;
import com.openforge.writecrew.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String DEFAULT_TIER = "free";

    private final UserRepository  userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil         jwtUtil;

    @Transactional
    public AuthResponse register(RegisterRequest req) {
        if (userRepository.existsByUsername(req.username())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Username already taken");
        }
        if (req.email() != null && !req.email().isBlank() && userRepository.existsByEmail(req.email())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Email already registered");
        }

        User user = new User();
        user.setUsername(req.username());
        user.setEmail(normalize(req.email()));
        user.setDisplayName(req.displayName() == null || req.displayName().isBlank()
                ? req.username()
                : req.displayName());
        user.setTier(req.tier() == null ? DEFAULT_TIER : req.tier());
        user.setPasswordHash(passwordEncoder.encode(req.password()));
        user.setStatus(User.Status.ACTIVE);

        User saved = userRepository.save(user);
        log.info("[Auth] New user registered: id={}, username={}, tier={}",
                saved.getId(), saved.getUsername(), saved.getTier());

        return toResponse(saved);
    }

    @Transactional
    public AuthResponse login(LoginRequest req) {
        User user = userRepository
                .findByUsernameOrEmail(req.identifier(), req.identifier())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unknown user or wrong password"));

        if (user.getStatus() == User.Status.DISABLED) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Account disabled");
        }

        if (!passwordEncoder.matches(req.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unknown user or wrong password");
        }

        user.setLastLoginTime(LocalDateTime.now());
        return toResponse(user);
    }

    private AuthResponse toResponse(User user) {
        String token = jwtUtil.generate(user.getId(), user.getUsername(), user.getTier());
        return new AuthResponse(user.getId(), user.getUsername(), user.getDisplayName(), user.getTier(), token);
    }

    private String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
