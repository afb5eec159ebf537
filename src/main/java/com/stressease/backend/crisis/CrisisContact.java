package com.stressease.backend.crisis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Entry of the static crisis-contact catalog.
 *
 * Closed set of variants; each carries only the fields that are valid for it:
 * emergency services and hotlines are reached by number, online resources by
 * website. Hotlines may also list a website.
 */
public sealed interface CrisisContact
        permits CrisisContact.Emergency, CrisisContact.Hotline, CrisisContact.OnlineResource {

    String id();

    ContactType type();

    String name();

    String description();

    String availability();

    String country();

    int priority();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "type", "name", "number", "description", "availability", "country", "priority"})
    record Emergency(String id, String name, String number, String description,
                     String availability, String country, int priority) implements CrisisContact {

        @Override
        @JsonProperty("type")
        public ContactType type() {
            return ContactType.EMERGENCY;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "type", "name", "number", "description", "website", "availability", "country", "priority"})
    record Hotline(String id, String name, String number, String description, String website,
                   String availability, String country, int priority) implements CrisisContact {

        @Override
        @JsonProperty("type")
        public ContactType type() {
            return ContactType.CRISIS_HOTLINE;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "type", "name", "description", "website", "availability", "country", "priority"})
    record OnlineResource(String id, String name, String description, String website,
                          String availability, String country, int priority) implements CrisisContact {

        @Override
        @JsonProperty("type")
        public ContactType type() {
            return ContactType.ONLINE_RESOURCE;
        }
    }
}
