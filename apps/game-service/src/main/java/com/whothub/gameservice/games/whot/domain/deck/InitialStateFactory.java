package com.whothub.gameservice.games.whot.domain.deck;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 新对局的初始局面（ONE 号位视角）。
 */
public interface InitialStateFactory {

    ObjectNode newGame();
}
