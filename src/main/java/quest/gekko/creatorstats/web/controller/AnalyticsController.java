package quest.gekko.creatorstats.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import quest.gekko.creatorstats.domain.AnalyticsSnapshot;
import quest.gekko.creatorstats.domain.PlatformRequest;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.service.analytics.AnalyticsOrchestrator;
import quest.gekko.creatorstats.service.credential.CredentialLifecycleManager;
import quest.gekko.creatorstats.web.dto.CredentialStatusDTO;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsOrchestrator analyticsOrchestrator;
    private final CredentialLifecycleManager lifecycleManager;

    // Public lookups, e.g. /api/stats?platform=youtube:UC123&platform=twitch:somestreamer
    @GetMapping("/stats")
    public List<PlatformSnapshot> publicStats(@RequestParam("platform") List<String> platforms) {
        return analyticsOrchestrator.getAllPlatformStats(parse(platforms), null);
    }

    @GetMapping("/users/{userId}/stats")
    public List<PlatformSnapshot> userStats(@PathVariable String userId,
                                            @RequestParam("platform") List<String> platforms) {
        return analyticsOrchestrator.getAllPlatformStats(parse(platforms), userId);
    }

    @GetMapping("/users/{userId}/analytics")
    public AnalyticsSnapshot analytics(@PathVariable String userId,
                                       @RequestParam("platform") List<String> platforms) {
        List<PlatformSnapshot> snapshots = analyticsOrchestrator.getAllPlatformStats(parse(platforms), userId);
        return analyticsOrchestrator.buildReport(snapshots, userId);
    }

    // Report over snapshots the caller already holds
    @PostMapping("/users/{userId}/analytics")
    public AnalyticsSnapshot analyticsFor(@PathVariable String userId, @RequestBody List<PlatformSnapshot> snapshots) {
        return analyticsOrchestrator.buildReport(snapshots, userId);
    }

    @GetMapping("/users/{userId}/credentials")
    public List<String> connectedPlatforms(@PathVariable String userId) {
        return lifecycleManager.connectedPlatforms(userId);
    }

    @GetMapping("/users/{userId}/credentials/{platform}")
    public CredentialStatusDTO credentialStatus(@PathVariable String userId, @PathVariable String platform) {
        return lifecycleManager.getValidToken(userId, platform)
                .map(credential -> new CredentialStatusDTO(platform, true, credential.expiresAt()))
                .orElseGet(() -> new CredentialStatusDTO(platform, false, null));
    }

    @DeleteMapping("/users/{userId}/credentials/{platform}")
    public ResponseEntity<Void> disconnect(@PathVariable String userId, @PathVariable String platform) {
        lifecycleManager.removeCredential(userId, platform);
        return ResponseEntity.noContent().build();
    }

    private static List<PlatformRequest> parse(List<String> platforms) {
        return platforms.stream().map(PlatformRequest::parse).toList();
    }
}
