package feed.reader.app.service;

import feed.reader.app.entity.User;
import feed.reader.app.repository.UserRepository;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Maps the authenticated principal onto a local owner row, creating it on first sight.
 */
@Service
public class OwnerService {
    private final UserRepository userRepository;

    public OwnerService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional
    public User getOrCreateUser(Authentication authentication) {
        String userId = authentication.getName(); // OAuth subject
        String email = null;
        if (authentication.getPrincipal() instanceof OAuth2User) {
            email = ((OAuth2User) authentication.getPrincipal()).getAttribute("email");
        }

        Optional<User> existingUser = userRepository.findById(userId);
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (email != null && !email.equals(user.getPrimaryEmail())) {
                user.setPrimaryEmail(email);
                userRepository.save(user);
            }
            return user;
        }
        User user = new User();
        user.setId(userId);
        user.setPrimaryEmail(email);
        return userRepository.save(user);
    }

    public String ownerId(Authentication authentication) {
        return getOrCreateUser(authentication).getId();
    }
}
