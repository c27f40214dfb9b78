package com.onalog.discovery.lead.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SearchJobNotFoundException extends RuntimeException {
    public SearchJobNotFoundException(long searchJobId) {
        super("search job " + searchJobId + " not found");
    }
}
