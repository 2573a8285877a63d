package com.libragraph.stash.core.access;

import com.libragraph.stash.core.dao.NoteRecord;
import com.libragraph.stash.core.dao.StoredObjectRecord;
import com.libragraph.stash.types.Visibility;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Visibility rules, evaluated before any stored byte is touched.
 *
 * <ul>
 *   <li>public: anyone may read</li>
 *   <li>private and unlisted: only the owner may read</li>
 *   <li>mutations: only the owner, whatever the visibility</li>
 * </ul>
 */
@ApplicationScoped
public class AccessPolicy {

    public AccessDecision authorizeRead(long callerId, long ownerId, Visibility visibility) {
        if (visibility == Visibility.PUBLIC || callerId == ownerId) {
            return AccessDecision.ALLOW;
        }
        return AccessDecision.DENY;
    }

    public AccessDecision authorizeMutation(long callerId, long ownerId) {
        return callerId == ownerId ? AccessDecision.ALLOW : AccessDecision.DENY;
    }

    public AccessDecision authorizeRead(long callerId, StoredObjectRecord object) {
        return authorizeRead(callerId, object.ownerId(), object.visibility());
    }

    public AccessDecision authorizeMutation(long callerId, StoredObjectRecord object) {
        return authorizeMutation(callerId, object.ownerId());
    }

    public void requireRead(long callerId, StoredObjectRecord object) {
        if (!authorizeRead(callerId, object).allowed()) {
            throw new AccessDeniedException(callerId, "object " + object.id());
        }
    }

    public void requireMutation(long callerId, StoredObjectRecord object) {
        if (!authorizeMutation(callerId, object).allowed()) {
            throw new AccessDeniedException(callerId, "object " + object.id());
        }
    }

    public void requireRead(long callerId, NoteRecord note) {
        if (!authorizeRead(callerId, note.ownerId(), note.visibility()).allowed()) {
            throw new AccessDeniedException(callerId, "note " + note.id());
        }
    }

    public void requireMutation(long callerId, NoteRecord note) {
        if (!authorizeMutation(callerId, note.ownerId()).allowed()) {
            throw new AccessDeniedException(callerId, "note " + note.id());
        }
    }
}
