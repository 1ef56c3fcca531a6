package com.nikoh.matchmaking.service.matching;

import com.nikoh.matchmaking.domain.Gender;
import com.nikoh.matchmaking.domain.InterestStatus;
import com.nikoh.matchmaking.domain.Match;
import com.nikoh.matchmaking.domain.MatchStatus;
import com.nikoh.matchmaking.domain.Profile;
import com.nikoh.matchmaking.domain.SearchPreference;
import com.nikoh.matchmaking.domain.UserStatus;
import com.nikoh.matchmaking.dto.MatchSuggestion;
import com.nikoh.matchmaking.dto.SuggestionPage;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.InterestRepository;
import com.nikoh.matchmaking.repository.MatchRepository;
import com.nikoh.matchmaking.repository.ProfileRepository;
import com.nikoh.matchmaking.repository.SearchPreferenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ranks candidate profiles for a viewer and answers the inverse "who likes me" question.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SuggestionService {

    private final ProfileRepository profileRepository;
    private final SearchPreferenceRepository searchPreferenceRepository;
    private final InterestRepository interestRepository;
    private final MatchRepository matchRepository;
    private final CompatibilityScorer compatibilityScorer;
    private final Clock clock;

    /**
     * Visible, active candidates of the gender the viewer is seeking, scored and sorted by
     * descending compatibility. Equal scores keep retrieval order.
     */
    public SuggestionPage getSuggestions(UUID viewerUserId, int limit) {
        Optional<Profile> viewerProfile = profileRepository.findByUserId(viewerUserId);
        if (viewerProfile.isEmpty()) {
            log.debug("No profile for user {}, no suggestions", viewerUserId);
            return SuggestionPage.empty();
        }
        Profile viewer = viewerProfile.get();
        SearchPreference viewerPreferences = searchPreferenceRepository.findByUserId(viewerUserId).orElse(null);

        Set<UUID> excluded = excludedUserIds(viewerUserId);
        List<Profile> candidates = loadCandidates(viewer, viewerUserId).stream()
                .filter(candidate -> !excluded.contains(candidate.getUser().getId()))
                .collect(Collectors.toList());

        Map<UUID, SearchPreference> candidatePreferences = preferencesOf(candidates);
        LocalDate today = LocalDate.now(clock);

        List<MatchSuggestion> ranked = new ArrayList<>(candidates.size());
        for (Profile candidate : candidates) {
            CompatibilityResult result = compatibilityScorer.score(viewer, viewerPreferences, candidate,
                    candidatePreferences.get(candidate.getUser().getId()));
            ranked.add(toSuggestion(candidate, result.getScore(), result.isMutual(), today));
        }
        // List.sort is stable
        ranked.sort(Comparator.comparingInt(MatchSuggestion::getCompatibilityScore).reversed());

        log.debug("Ranked {} candidates for user {}", ranked.size(), viewerUserId);
        return SuggestionPage.builder()
                .suggestions(new ArrayList<>(ranked.subList(0, Math.min(Math.max(limit, 0), ranked.size()))))
                .totalAvailable(ranked.size())
                .build();
    }

    /**
     * Users whose own preferences would accept the viewer and who have not sent interest yet.
     */
    public SuggestionPage getWhoLikesMe(UUID viewerUserId, int limit) {
        Optional<Profile> viewerProfile = profileRepository.findByUserId(viewerUserId);
        if (viewerProfile.isEmpty()) {
            return SuggestionPage.empty();
        }
        List<Profile> admirers = findAdmirers(viewerProfile.get(), viewerUserId);
        LocalDate today = LocalDate.now(clock);

        List<MatchSuggestion> profiles = admirers.stream()
                .limit(Math.max(limit, 0))
                .map(profile -> toSuggestion(profile, 0, true, today))
                .collect(Collectors.toList());

        return SuggestionPage.builder()
                .suggestions(profiles)
                .totalAvailable(admirers.size())
                .build();
    }

    /**
     * Count only, for viewers who may not see the profiles themselves
     */
    public long countWhoLikesMe(UUID viewerUserId) {
        return profileRepository.findByUserId(viewerUserId)
                .map(viewer -> (long) findAdmirers(viewer, viewerUserId).size())
                .orElse(0L);
    }

    public boolean isViewerVerified(UUID viewerUserId) {
        return profileRepository.findByUserId(viewerUserId)
                .map(profile -> profile.getUser().isVerified())
                .orElse(false);
    }

    public CompatibilityResult getCompatibility(UUID viewerUserId, UUID profileId) {
        Profile viewer = profileRepository.findByUserId(viewerUserId)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", "user " + viewerUserId));
        Profile target = profileRepository.findWithUserById(profileId)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", profileId));

        return compatibilityScorer.score(
                viewer,
                searchPreferenceRepository.findByUserId(viewerUserId).orElse(null),
                target,
                searchPreferenceRepository.findByUserId(target.getUser().getId()).orElse(null));
    }

    private List<Profile> loadCandidates(Profile viewer, UUID viewerUserId) {
        Gender seeking = viewer.getSeekingGender();
        if (seeking == null) {
            return profileRepository.findVisibleCandidates(viewerUserId, UserStatus.ACTIVE);
        }
        return profileRepository.findVisibleCandidatesByGender(viewerUserId, seeking, UserStatus.ACTIVE);
    }

    private Set<UUID> excludedUserIds(UUID viewerUserId) {
        Set<UUID> excluded = new HashSet<>(interestRepository.findRecipientIdsBySender(viewerUserId));
        excluded.addAll(interestRepository.findSenderIdsByRecipientAndStatus(viewerUserId, InterestStatus.DECLINED));
        for (Match match : matchRepository.findByParticipantAndStatus(viewerUserId, MatchStatus.ACTIVE)) {
            excluded.add(match.partnerOf(viewerUserId));
        }
        excluded.add(viewerUserId);
        return excluded;
    }

    private List<Profile> findAdmirers(Profile viewer, UUID viewerUserId) {
        if (viewer.getGender() == null) {
            return List.of();
        }
        List<Profile> seekers = profileRepository.findSeekingGender(viewerUserId, viewer.getGender(), UserStatus.ACTIVE);
        Set<UUID> alreadySent = new HashSet<>(interestRepository.findSenderIdsByRecipient(viewerUserId));
        Map<UUID, SearchPreference> preferences = preferencesOf(seekers);

        Integer viewerAge = viewer.ageOn(LocalDate.now(clock));
        String viewerCountry = viewer.locationCountry();

        List<Profile> admirers = new ArrayList<>();
        for (Profile seeker : seekers) {
            UUID seekerId = seeker.getUser().getId();
            SearchPreference preference = preferences.get(seekerId);
            if (preference == null || alreadySent.contains(seekerId)) {
                continue;
            }
            if (viewerAge != null && !preference.acceptsAge(viewerAge)) {
                continue;
            }
            if (!CompatibilityScorer.matchesList(preference.getPreferredCountries(), viewerCountry)
                    || !CompatibilityScorer.matchesList(preference.getPreferredEthnicities(), viewer.getEthnicity())) {
                continue;
            }
            admirers.add(seeker);
        }
        return admirers;
    }

    private Map<UUID, SearchPreference> preferencesOf(List<Profile> profiles) {
        if (profiles.isEmpty()) {
            return Map.of();
        }
        List<UUID> userIds = profiles.stream().map(profile -> profile.getUser().getId()).collect(Collectors.toList());
        return searchPreferenceRepository.findByUserIdIn(userIds).stream()
                .collect(Collectors.toMap(SearchPreference::getUserId, Function.identity(), (first, second) -> first));
    }

    private MatchSuggestion toSuggestion(Profile profile, int score, boolean mutual, LocalDate today) {
        return MatchSuggestion.builder()
                .profileId(profile.getId())
                .userId(profile.getUser().getId())
                .displayName(profile.displayName())
                .age(profile.ageOn(today))
                .city(profile.getCurrentCity())
                .country(profile.locationCountry())
                .compatibilityScore(score)
                .mutualMatch(mutual)
                .verified(profile.getUser().isVerified())
                .build();
    }
}
