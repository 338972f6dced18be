package com.vapeshop.shop.service;

import com.vapeshop.shop.domain.model.User;
import com.vapeshop.shop.exception.ValidationException;
import com.vapeshop.shop.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Admin broadcasts. There is no delivery channel: each recipient is only logged.
 *
 * @author Vape Shop Team
 */
@Service
public class BroadcastService {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastService.class);

    private final UserRepository userRepository;

    public BroadcastService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * @param message Text to send
     * @return Number of users the message was addressed to
     */
    public int broadcast(String message) {
        if (message == null || message.isBlank()) {
            throw new ValidationException("message", "Field 'message' is required");
        }
        List<User> recipients = userRepository.list();
        for (User user : recipients) {
            logger.info("Broadcast to user {}: {}", user.getId(), message);
        }
        logger.info("Broadcast addressed to {} users", recipients.size());
        return recipients.size();
    }
}
