package com.openforge.lexguard.support;

import com.openforge.lexguard.domain.User;
import com.openforge.lexguard.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.test.context.TestComponent;

import java.util.UUID;

/** Creates throwaway accounts; every test gets its own user so shared H2 state never leaks between tests. */
@TestComponent
@RequiredArgsConstructor
public class TestAccounts {

    private final UserRepository userRepository;

    public User create(User.Role role) {
        String name = role.name().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8);
        User user = new User();
        user.setUsername(name);
        user.setEmail(name + "@example.test");
        user.setDisplayName(name);
        user.setPasswordHash("$2a$10$notarealhashnotarealhashnotarealhashnotarealhashnot");
        user.setRole(role);
        return userRepository.save(user);
    }

    public Long user() {
        return create(User.Role.USER).getId();
    }

    public Long admin() {
        return create(User.Role.ADMIN).getId();
    }
}
