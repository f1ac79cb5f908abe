package com.flagship.property_settlement.history;

public enum ChangeSource {
    WEB,
    MOBILE,
    API,
    SYSTEM
}
