package tech.noetzold.zta.gateway_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.ott.GenerateOneTimeTokenRequest;
import org.springframework.security.authentication.ott.OneTimeToken;
import org.springframework.security.authentication.ott.OneTimeTokenService;
import org.springframework.stereotype.Service;

/**
 * Issues the single-use challenge a client presents to its second factor after a step-up decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StepUpChallengeIssuer {

    private final OneTimeTokenService tokenService;

    public OneTimeToken issue(String sessionId) {
        OneTimeToken token = tokenService.generate(new GenerateOneTimeTokenRequest(sessionId));
        log.info("Step-up challenge issued session={} expires_at={}", sessionId, token.getExpiresAt());
        return token;
    }
}
