package com.openforge.writecrew.document;

/**
 * Pushes applied changes to the presentation surface.  Called while the
 * document lock is held, so events per document arrive in apply order.
 */
public interface CollaborationBroadcaster {

    void documentChanged(DocumentChange change, DocumentState state);
}
