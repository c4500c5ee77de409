package com.survey.boothsampling.model;

/**
 * How the booth and boundary coordinate reference systems were reconciled
 */
public enum ReferenceCheck {
    // Both layers declared the same system
    MATCHED,
    // Booth points were transformed into the boundary's system
    REPROJECTED,
    // At least one layer declared no system, raw coordinates were compared
    UNVERIFIED
}
