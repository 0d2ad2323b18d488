package com.conveyal.trackingauth.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A user account known to the authorization layer. The password is only ever held as a salted hash.
 * The permission lists are not part of the stored record; they are filled in when the user is returned over the API.
 */
public class User {

    public long id;

    public String username;

    @JsonIgnore
    public String passwordHash;

    @JsonProperty("is_admin")
    public boolean admin;

    public List<ResourcePermission> experimentPermissions;

    public List<ResourcePermission> registeredModelPermissions;

    /** Zero-argument constructor for deserialization. */
    public User () { }

    public User (long id, String username, String passwordHash, boolean admin) {
        this.id = id;
        this.username = username;
        this.passwordHash = passwordHash;
        this.admin = admin;
    }

    /** A copy for returning over the API, including the grants held by this user. */
    public User withPermissions (List<ResourcePermission> experiments, List<ResourcePermission> registeredModels) {
        User copy = new User(id, username, passwordHash, admin);
        copy.experimentPermissions = experiments;
        copy.registeredModelPermissions = registeredModels;
        return copy;
    }

    @Override
    public String toString () {
        return "User{" + "id=" + id + ", username='" + username + '\'' + ", admin=" + admin + '}';
    }
}
