package com.polytick.core.market;

public record SideRef(String instrumentId, SideLabel side) {
}
