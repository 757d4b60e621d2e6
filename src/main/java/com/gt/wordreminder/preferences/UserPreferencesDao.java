package com.gt.wordreminder.preferences;

import com.gt.wordreminder.model.UserPreferences;

import java.time.Instant;
import java.util.List;

public interface UserPreferencesDao {

    UserPreferences loadUserPreferences(long owner);

    // Returns false if preferences already exist for the owner
    boolean createUserPreferences(UserPreferences userPreferences);

    int saveUserPreferences(UserPreferences userPreferences);

    // Paused owners are left out
    List<UserPreferences> loadPreferencesDueForReminder(Instant now);

    // Sets last_engaged_at, clears the missed count and unpauses
    int recordActivity(long owner, Instant now);
}
