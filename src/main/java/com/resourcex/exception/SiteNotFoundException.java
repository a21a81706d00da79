package com.resourcex.exception;

import lombok.Getter;

@Getter
public class SiteNotFoundException extends ResourceNotFoundException {

    private final int gid;

    public SiteNotFoundException(int gid, int siteCount) {
        super("Site gid " + gid + " is out of range [0, " + siteCount + ")");
        this.gid = gid;
    }

    public SiteNotFoundException(String message) {
        super(message);
        this.gid = -1;
    }
}
