package de.mirkosertic.nlpquery.context;

import de.mirkosertic.nlpquery.Language;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity, preferences and recent activity of a user.
 *
 * <p>Recent queries, documents and topics keep the 10 newest entries, most recent first. The
 * search history keeps 20 distinct queries. Activity lists are guarded by the instance lock and
 * getters return snapshots.</p>
 */
public class UserContext {

    public static final int MAX_RECENT_ACTIVITY = 10;
    public static final int MAX_SEARCH_HISTORY = 20;

    private final String id;
    private final String role;
    private final @Nullable String department;
    private final List<String> permissions;
    private final Language preferredLanguage;
    private final List<String> preferredDocumentTypes;

    private final List<String> recentQueries = new ArrayList<>();
    private final List<String> recentDocuments = new ArrayList<>();
    private final List<String> recentTopics = new ArrayList<>();
    private final List<String> searchHistory = new ArrayList<>();

    public UserContext(final String id, final String role, final @Nullable String department,
                       final List<String> permissions, final Language preferredLanguage,
                       final List<String> preferredDocumentTypes) {
        this.id = id;
        this.role = role;
        this.department = department;
        this.permissions = List.copyOf(permissions);
        this.preferredLanguage = preferredLanguage;
        this.preferredDocumentTypes = List.copyOf(preferredDocumentTypes);
    }

    /**
     * Anonymous reader used when no user is known.
     */
    public static UserContext defaultContext() {
        return new UserContext("default", "user", null, List.of("read"), Language.EN, List.of());
    }

    /**
     * Apply an activity to the bounded lists.
     */
    public synchronized void record(final UserActivity activity) {
        if (activity.query() != null) {
            pushFront(recentQueries, activity.query(), MAX_RECENT_ACTIVITY);
            if (!searchHistory.contains(activity.query())) {
                pushFront(searchHistory, activity.query(), MAX_SEARCH_HISTORY);
            }
        }
        if (activity.documentId() != null) {
            pushFront(recentDocuments, activity.documentId(), MAX_RECENT_ACTIVITY);
        }
        if (activity.topic() != null && !recentTopics.contains(activity.topic())) {
            pushFront(recentTopics, activity.topic(), MAX_RECENT_ACTIVITY);
        }
    }

    private static void pushFront(final List<String> list, final String value, final int cap) {
        list.add(0, value);
        while (list.size() > cap) {
            list.remove(list.size() - 1);
        }
    }

    public String getId() {
        return id;
    }

    public String getRole() {
        return role;
    }

    public @Nullable String getDepartment() {
        return department;
    }

    public List<String> getPermissions() {
        return permissions;
    }

    public Language getPreferredLanguage() {
        return preferredLanguage;
    }

    public List<String> getPreferredDocumentTypes() {
        return preferredDocumentTypes;
    }

    public synchronized List<String> getRecentQueries() {
        return List.copyOf(recentQueries);
    }

    public synchronized List<String> getRecentDocuments() {
        return List.copyOf(recentDocuments);
    }

    public synchronized List<String> getRecentTopics() {
        return List.copyOf(recentTopics);
    }

    public synchronized List<String> getSearchHistory() {
        return List.copyOf(searchHistory);
    }

    @Override
    public String toString() {
        return "UserContext{id='" + id + "', role='" + role + "', department='" + department + "'}";
    }
}
