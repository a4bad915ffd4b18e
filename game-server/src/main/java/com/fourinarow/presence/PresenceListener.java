package com.fourinarow.presence;

import java.util.List;

/**
 * Receives the online list after every presence mutation.
 */
@FunctionalInterface
public interface PresenceListener {

    void onPresenceChanged(List<ConnectedUser> onlineUsers);
}
