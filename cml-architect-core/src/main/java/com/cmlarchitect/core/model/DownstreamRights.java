package com.cmlarchitect.core.model;

/**
 * How much say the downstream team has over the upstream context.
 */
public enum DownstreamRights {
    INFLUENCER,
    OPINIONATED_CONFORMIST,
    VETO_RIGHT
}
