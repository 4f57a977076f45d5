package com.chess.replay.service;

import com.chess.replay.model.PositionSnapshot;

/**
 * Receives the new position after a session loads a game or navigates. Implemented by
 * whatever draws the board or builds move context from it.
 */
public interface ReplayListener {

    void positionChanged(PositionSnapshot position);
}
