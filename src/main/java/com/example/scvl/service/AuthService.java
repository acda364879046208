package com.example.scvl.service;

import com.example.scvl.dto.AuthResponse;
import com.example.scvl.dto.LoginRequest;
import com.example.scvl.dto.RegisterRequest;
import com.example.scvl.exception.UnauthorizedException;
import com.example.scvl.exception.ValidationException;
import com.example.scvl.model.AppUser;
import com.example.scvl.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.mindrot.jbcrypt.BCrypt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class AuthService {

    private final AppUserRepository userRepository;
    private final JwtService jwtService;

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = request.getEmail().toLowerCase(Locale.ROOT);
        if (userRepository.findByEmail(email).isPresent()) {
            throw new ValidationException("Email already registered");
        }

        AppUser user = new AppUser();
        user.setName(request.getName());
        user.setEmail(email);
        user.setPasswordHash(BCrypt.hashpw(request.getPassword(), BCrypt.gensalt()));
        user = userRepository.save(user);

        String token = jwtService.generateToken(user.getId(), user.getEmail());
        return new AuthResponse(user.getId(), user.getName(), user.getEmail(), token);
    }

    public AuthResponse login(LoginRequest request) {
        String email = request.getEmail().toLowerCase(Locale.ROOT);
        AppUser user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UnauthorizedException("Invalid email or password"));

        if (!BCrypt.checkpw(request.getPassword(), user.getPasswordHash())) {
            throw new UnauthorizedException("Invalid email or password");
        }

        String token = jwtService.generateToken(user.getId(), user.getEmail());
        return new AuthResponse(user.getId(), user.getName(), user.getEmail(), token);
    }

    /**
     * Resolves the caller set by {@code AuthInterceptor}; absent or deleted users are unauthorized.
     */
    public AppUser requireUser(Long userId) {
        if (userId == null) {
            throw new UnauthorizedException("Unauthorized");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new UnauthorizedException("Unauthorized"));
    }
}
