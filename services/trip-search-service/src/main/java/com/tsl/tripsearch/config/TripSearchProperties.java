package com.tsl.tripsearch.config;

import com.tsl.tripsearch.surface.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trip-search")
public class TripSearchProperties {
    private Classifier classifier = new Classifier();
    private Search search = new Search();
    private Fallback fallback = new Fallback();
    private Scoring scoring = new Scoring();
    private Facts facts = new Facts();
    private Semantic semantic = new Semantic();

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Facts getFacts() {
        return facts;
    }

    public void setFacts(Facts facts) {
        this.facts = facts;
    }

    public Semantic getSemantic() {
        return semantic;
    }

    public void setSemantic(Semantic semantic) {
        this.semantic = semantic;
    }

    public static class Classifier {
        private int maxTerms = 3;

        public int getMaxTerms() {
            return maxTerms;
        }

        public void setMaxTerms(int maxTerms) {
            this.maxTerms = maxTerms;
        }
    }

    public static class Search {
        private int defaultLimit = 5;
        private int maxLimit = 50;
        private int candidateLimit = 25;
        private int secondaryLimit = 5;
        private int emergencyLimit = 3;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getCandidateLimit() {
            return candidateLimit;
        }

        public void setCandidateLimit(int candidateLimit) {
            this.candidateLimit = candidateLimit;
        }

        public int getSecondaryLimit() {
            return secondaryLimit;
        }

        public void setSecondaryLimit(int secondaryLimit) {
            this.secondaryLimit = secondaryLimit;
        }

        public int getEmergencyLimit() {
            return emergencyLimit;
        }

        public void setEmergencyLimit(int emergencyLimit) {
            this.emergencyLimit = emergencyLimit;
        }
    }

    public static class Fallback {
        private long nearTimeoutMs = 800;

        public long getNearTimeoutMs() {
            return nearTimeoutMs;
        }

        public void setNearTimeoutMs(long nearTimeoutMs) {
            this.nearTimeoutMs = nearTimeoutMs;
        }
    }

    public static class Scoring {
        private int slugExact = 160;
        private int tripIdExact = 140;
        private int primaryEmailExact = 120;
        private int travelerEmailMatch = 80;
        private int tokenMatch = 22;
        private int phoneticMatch = 14;
        private int normalizedTripName = 12;
        private int destinationMatch = 10;
        private int travelerMatch = 9;
        private int emailToken = 7;
        private int primaryClientName = 6;
        private int tripNamePartial = 6;
        private int confirmedStatus = 3;
        private int maxTravelerBonus = 5;

        public ScoringWeights toWeights() {
            return new ScoringWeights(
                slugExact,
                tripIdExact,
                primaryEmailExact,
                travelerEmailMatch,
                tokenMatch,
                phoneticMatch,
                normalizedTripName,
                destinationMatch,
                travelerMatch,
                emailToken,
                primaryClientName,
                tripNamePartial,
                confirmedStatus,
                maxTravelerBonus
            );
        }

        public int getSlugExact() {
            return slugExact;
        }

        public void setSlugExact(int slugExact) {
            this.slugExact = slugExact;
        }

        public int getTripIdExact() {
            return tripIdExact;
        }

        public void setTripIdExact(int tripIdExact) {
            this.tripIdExact = tripIdExact;
        }

        public int getPrimaryEmailExact() {
            return primaryEmailExact;
        }

        public void setPrimaryEmailExact(int primaryEmailExact) {
            this.primaryEmailExact = primaryEmailExact;
        }

        public int getTravelerEmailMatch() {
            return travelerEmailMatch;
        }

        public void setTravelerEmailMatch(int travelerEmailMatch) {
            this.travelerEmailMatch = travelerEmailMatch;
        }

        public int getTokenMatch() {
            return tokenMatch;
        }

        public void setTokenMatch(int tokenMatch) {
            this.tokenMatch = tokenMatch;
        }

        public int getPhoneticMatch() {
            return phoneticMatch;
        }

        public void setPhoneticMatch(int phoneticMatch) {
            this.phoneticMatch = phoneticMatch;
        }

        public int getNormalizedTripName() {
            return normalizedTripName;
        }

        public void setNormalizedTripName(int normalizedTripName) {
            this.normalizedTripName = normalizedTripName;
        }

        public int getDestinationMatch() {
            return destinationMatch;
        }

        public void setDestinationMatch(int destinationMatch) {
            this.destinationMatch = destinationMatch;
        }

        public int getTravelerMatch() {
            return travelerMatch;
        }

        public void setTravelerMatch(int travelerMatch) {
            this.travelerMatch = travelerMatch;
        }

        public int getEmailToken() {
            return emailToken;
        }

        public void setEmailToken(int emailToken) {
            this.emailToken = emailToken;
        }

        public int getPrimaryClientName() {
            return primaryClientName;
        }

        public void setPrimaryClientName(int primaryClientName) {
            this.primaryClientName = primaryClientName;
        }

        public int getTripNamePartial() {
            return tripNamePartial;
        }

        public void setTripNamePartial(int tripNamePartial) {
            this.tripNamePartial = tripNamePartial;
        }

        public int getConfirmedStatus() {
            return confirmedStatus;
        }

        public void setConfirmedStatus(int confirmedStatus) {
            this.confirmedStatus = confirmedStatus;
        }

        public int getMaxTravelerBonus() {
            return maxTravelerBonus;
        }

        public void setMaxTravelerBonus(int maxTravelerBonus) {
            this.maxTravelerBonus = maxTravelerBonus;
        }
    }

    public static class Facts {
        private int inlineRefreshMaxActivities = 10;
        private int bulkDefaultLimit = 20;

        public int getInlineRefreshMaxActivities() {
            return inlineRefreshMaxActivities;
        }

        public void setInlineRefreshMaxActivities(int inlineRefreshMaxActivities) {
            this.inlineRefreshMaxActivities = inlineRefreshMaxActivities;
        }

        public int getBulkDefaultLimit() {
            return bulkDefaultLimit;
        }

        public void setBulkDefaultLimit(int bulkDefaultLimit) {
            this.bulkDefaultLimit = bulkDefaultLimit;
        }
    }

    public static class Semantic {
        private int defaultMaxResults = 10;
        private int candidateTripLimit = 100;

        public int getDefaultMaxResults() {
            return defaultMaxResults;
        }

        public void setDefaultMaxResults(int defaultMaxResults) {
            this.defaultMaxResults = defaultMaxResults;
        }

        public int getCandidateTripLimit() {
            return candidateTripLimit;
        }

        public void setCandidateTripLimit(int candidateTripLimit) {
            this.candidateTripLimit = candidateTripLimit;
        }
    }
}
