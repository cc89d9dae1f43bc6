package com.coopvault.governance;

public enum ProposerRole {
    MEMBER,
    MERCHANT,
    ANCHOR,
    BOT
}
