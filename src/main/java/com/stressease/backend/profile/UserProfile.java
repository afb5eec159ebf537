package com.stressease.backend.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

/**
 * Profile written by the mobile client during onboarding. Read-only here;
 * used to personalize the opening persona prompt of a chat session.
 *
 * Collection: users (document id = verified subject id)
 */
@Document(collection = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    @Id
    private String userId;

    private String name;

    private Integer age;

    @Field("health_conditions")
    private List<String> healthConditions;

    @Field("stress_triggers")
    private List<String> stressTriggers;

    private List<String> goals;
}
