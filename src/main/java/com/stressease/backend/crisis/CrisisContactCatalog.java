package com.stressease.backend.crisis;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Fixed catalog of crisis contacts shown when a user accepts (or declines)
 * a crisis-resource offer. Never generated, never looked up per region.
 */
@Component
public class CrisisContactCatalog {

    private static final List<CrisisContact> CONTACTS = List.<CrisisContact>of(
            new CrisisContact.Emergency(
                    "emergency-services",
                    "Emergency Services",
                    "112",
                    "Call immediately if you or someone near you is in immediate danger.",
                    "24/7", "International", 1),
            new CrisisContact.Hotline(
                    "lifeline-988",
                    "988 Suicide & Crisis Lifeline",
                    "988",
                    "Free, confidential support for people in distress. Call or text.",
                    "https://988lifeline.org",
                    "24/7", "United States", 2),
            new CrisisContact.Hotline(
                    "kiran-helpline",
                    "KIRAN Mental Health Rehabilitation Helpline",
                    "1800-599-0019",
                    "Government of India helpline offering mental health support in multiple languages.",
                    null,
                    "24/7", "India", 3),
            new CrisisContact.Hotline(
                    "crisis-text-line",
                    "Crisis Text Line",
                    "Text HOME to 741741",
                    "Text with a trained crisis counselor.",
                    "https://www.crisistextline.org",
                    "24/7", "United States", 4),
            new CrisisContact.OnlineResource(
                    "find-a-helpline",
                    "Find A Helpline",
                    "Directory of free, confidential helplines in over 130 countries.",
                    "https://findahelpline.com",
                    "Always available", "International", 5),
            new CrisisContact.OnlineResource(
                    "iasp-crisis-centres",
                    "IASP Crisis Centres",
                    "International Association for Suicide Prevention list of crisis centres worldwide.",
                    "https://www.iasp.info/crisis-centres-helplines/",
                    "Always available", "International", 6)
    );

    /** All contacts ordered by priority (1 = most urgent). */
    public List<CrisisContact> all() {
        return CONTACTS.stream()
                .sorted(Comparator.comparingInt(CrisisContact::priority))
                .toList();
    }
}
