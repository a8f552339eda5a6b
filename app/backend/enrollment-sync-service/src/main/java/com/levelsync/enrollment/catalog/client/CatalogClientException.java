package com.levelsync.enrollment.catalog.client;

/**
 * Course Catalog 호출 실패
 */
public class CatalogClientException extends RuntimeException {

    public CatalogClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
