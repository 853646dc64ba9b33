package com.yerin.collector.service;

import com.yerin.collector.domain.User;
import com.yerin.collector.repository.DatasetRepository;
import com.yerin.collector.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final DatasetRepository datasetRepository;
    private final DatasetService datasetService;
    private final NotificationService notificationService;

    @Transactional
    public User create(String name, Map<String, Object> userdata) {
        return userRepository.save(new User(name, userdata));
    }

    @Transactional(readOnly = true)
    public Optional<User> find(String name) {
        return userRepository.findById(name);
    }

    @Transactional(readOnly = true)
    public List<User> findWithDeleteAfter() {
        return userRepository.findByDeleteAfterIsNotNull();
    }

    /**
     * 사용자, 소유 데이터셋(하위 포함), 사용자 알림을 함께 지운다.
     */
    @Transactional
    public boolean delete(String name) {
        if (!userRepository.existsById(name)) return false;
        List<String> owned = datasetRepository.findKeysByOwner(name);
        for (String key : owned) {
            datasetService.delete(key);
        }
        notificationService.removeForRecipient(name);
        userRepository.deleteById(name);
        log.info("[User] deleted name={}, datasets={}", name, owned.size());
        return true;
    }
}
