package com.vidly.service;

import com.vidly.dto.request.UserRequest;
import com.vidly.dto.response.UserResponse;
import com.vidly.entity.User;
import com.vidly.exception.DuplicateEmailException;
import com.vidly.exception.ResourceNotFoundException;
import com.vidly.mapper.UserMapper;
import com.vidly.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<UserResponse> findAll() {
        return userRepository.findAll(Sort.by("name")).stream()
            .map(UserMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public UserResponse findById(Long id) {
        return UserMapper.toResponse(findUser(id));
    }

    /**
     * Looks up the account named by a verified token's {@code sub} claim. A subject that is
     * not a user id is treated the same as an unknown user.
     */
    @Transactional(readOnly = true)
    public UserResponse findByTokenSubject(String subject) {
        Long id;
        try {
            id = Long.valueOf(subject);
        } catch (NumberFormatException ex) {
            throw new ResourceNotFoundException("User not found for token subject " + subject);
        }
        return findById(id);
    }

    @Transactional
    public UserResponse create(UserRequest request) {
        String email = UserMapper.normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }
        User saved = userRepository.save(UserMapper.toEntity(request));
        return UserMapper.toResponse(saved);
    }

    @Transactional
    public UserResponse update(Long id, UserRequest request) {
        User user = findUser(id);

        String email = UserMapper.normalizeEmail(request.email());
        if (!email.equals(user.getEmail()) && userRepository.existsByEmailAndIdNot(email, id)) {
            throw new DuplicateEmailException(email);
        }

        UserMapper.updateEntity(user, request);
        return UserMapper.toResponse(userRepository.save(user));
    }

    @Transactional
    public UserResponse delete(Long id) {
        User user = findUser(id);
        userRepository.delete(user);
        return UserMapper.toResponse(user);
    }

    private User findUser(Long id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }
}
