package com.conveyal.trackingauth.persistence;

import com.conveyal.trackingauth.models.Session;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;

import java.util.Date;
import java.util.concurrent.TimeUnit;

import static com.mongodb.client.model.Filters.eq;

/**
 * Sessions stored in MongoDB, so that any server process can serve any logged-in client. A TTL index purges sessions
 * the clients stopped presenting; expiry itself is still checked on every use because the TTL monitor only runs
 * about once a minute.
 */
public class MongoSessionStore implements SessionStore {

    public interface Config {
        long sessionLifetimeSeconds ();
    }

    private final MongoCollection<Document> sessions;

    public MongoSessionStore (AuthDB database, Config config) {
        this.sessions = database.getBsonCollection("sessions");
        sessions.createIndex(Indexes.ascending("issuedAt"),
                new IndexOptions().expireAfter(config.sessionLifetimeSeconds(), TimeUnit.SECONDS));
    }

    @Override
    public void createSession (Session session) {
        Document document = new Document("_id", session.sessionId)
                .append("username", session.username)
                .append("userId", session.userId)
                .append("admin", session.admin)
                .append("issuedAt", session.issuedAt == null ? null : Date.from(session.issuedAt));
        sessions.replaceOne(eq("_id", session.sessionId), document, new ReplaceOptions().upsert(true));
    }

    @Override
    public Session getSession (String sessionId) {
        Document document = sessions.find(eq("_id", sessionId)).first();
        if (document == null) return null;
        Date issuedAt = document.getDate("issuedAt");
        Number userId = document.get("userId", Number.class);
        return new Session(
                sessionId,
                document.getString("username"),
                userId == null ? null : userId.longValue(),
                Boolean.TRUE.equals(document.getBoolean("admin")),
                issuedAt == null ? null : issuedAt.toInstant()
        );
    }

    @Override
    public void deleteSession (String sessionId) {
        sessions.deleteOne(eq("_id", sessionId));
    }

}
