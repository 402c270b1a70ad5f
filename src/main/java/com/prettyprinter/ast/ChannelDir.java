package com.prettyprinter.ast;

public enum ChannelDir {
    BOTH,
    RECV,
    SEND
}
