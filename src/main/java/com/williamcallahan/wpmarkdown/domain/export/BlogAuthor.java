package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Objects;

/**
 * Author credited for the whole blog.
 *
 * @param name display name
 * @param email contact email
 */
public record BlogAuthor(String name, String email) {

    public BlogAuthor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(email, "email");
    }
}
