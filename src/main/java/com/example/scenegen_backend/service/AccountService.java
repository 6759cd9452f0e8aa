package com.example.scenegen_backend.service;

import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.repository.AccountRepository;
import com.example.scenegen_backend.util.Hmacs;
import com.example.scenegen_backend.util.ProfileStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class AccountService {
    private static final String BEARER = "Bearer ";

    private final AccountRepository accounts;

    public AccountService(AccountRepository accounts) {
        this.accounts = accounts;
    }

    /** Accepts either a raw token or a full {@code Authorization} header value. */
    @Transactional(readOnly = true)
    public Account getUser(String token) {
        String raw = stripBearer(token);
        if (raw == null) {
            throw SceneGenException.unauthorized("Missing bearer token");
        }
        return accounts.findByApiTokenHash(hashToken(raw))
                .orElseThrow(() -> SceneGenException.unauthorized("Invalid or expired token"));
    }

    @Transactional(readOnly = true)
    public ProfileStatus getProfile(UUID accountId) {
        return accounts.findById(accountId)
                .map(Account::getProfileStatus)
                .orElseThrow(() -> SceneGenException.notFound("OWNER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public void requireApproved(Account account) {
        if (getProfile(account.getId()) != ProfileStatus.APPROVED) {
            throw SceneGenException.forbidden("Your account is pending admin approval");
        }
    }

    @Transactional
    public Account issueToken(Account account, String token) {
        account.setApiTokenHash(hashToken(token));
        return accounts.save(account);
    }

    public static String hashToken(String token) {
        return Hmacs.digestHex(token);
    }

    private static String stripBearer(String token) {
        if (token == null) return null;
        String t = token.trim();
        if (t.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            t = t.substring(BEARER.length()).trim();
        }
        return t.isEmpty() ? null : t;
    }
}
