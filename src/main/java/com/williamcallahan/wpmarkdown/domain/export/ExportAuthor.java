package com.williamcallahan.wpmarkdown.domain.export;

/**
 * Author entry from a WordPress export channel. Missing fields are empty strings.
 *
 * @param login account login
 * @param email contact email
 * @param displayName name shown on posts
 * @param firstName given name
 * @param lastName family name
 */
public record ExportAuthor(String login, String email, String displayName, String firstName, String lastName) {

    public ExportAuthor {
        login = login == null ? "" : login;
        email = email == null ? "" : email;
        displayName = displayName == null ? "" : displayName;
        firstName = firstName == null ? "" : firstName;
        lastName = lastName == null ? "" : lastName;
    }
}
