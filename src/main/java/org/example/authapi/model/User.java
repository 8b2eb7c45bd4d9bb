package org.example.authapi.model;

import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "User")
@Getter
@Setter
public class User {

    public static final String PROVIDER_EMAIL = "email";

    @Id
    private String id;

    // Stored lower-cased, so the unique index is case-insensitive in practice.
    @Indexed(unique = true)
    private String email;

    private String password; // BCrypt digest

    private String name;

    private String provider = PROVIDER_EMAIL;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public User() {}

    public User(String email, String password, String name) {
        this.email = email;
        this.password = password;
        this.name = name;
    }
}
