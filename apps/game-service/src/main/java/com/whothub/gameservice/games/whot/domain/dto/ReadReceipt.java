package com.whothub.gameservice.games.whot.domain.dto;

public record ReadReceipt(String readerId) {
}
