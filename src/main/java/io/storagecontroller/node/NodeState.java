package io.storagecontroller.node;

/**
 * Connection state of a storage node.
 *
 * <ul>
 *   <li><strong>DISCONNECTED</strong> - no connection to the storage agent</li>
 *   <li><strong>CONNECTING</strong> - connection open, first sync has not succeeded yet</li>
 *   <li><strong>SYNCED</strong> - last sync succeeded</li>
 *   <li><strong>SYNC_FAILED</strong> - recent syncs failed but fewer than the bad limit</li>
 *   <li><strong>OFFLINE</strong> - bad limit reached, all objects on the node forced offline</li>
 * </ul>
 */
public enum NodeState {
    DISCONNECTED,
    CONNECTING,
    SYNCED,
    SYNC_FAILED,
    OFFLINE
}
