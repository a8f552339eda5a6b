package com.levelsync.enrollment.common.capability;

import com.levelsync.enrollment.common.config.MembershipSyncProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * membership-sync 설정값 기반 Capabilities
 */
@Component
@RequiredArgsConstructor
public class PropertyCapabilities implements Capabilities {

    private final MembershipSyncProperties properties;

    @Override
    public boolean courseCatalogAvailable() {
        MembershipSyncProperties.Catalog catalog = properties.getCatalog();
        return catalog.isEnabled() && StringUtils.hasText(catalog.getBaseUrl());
    }

    @Override
    public boolean bundleAddonAvailable() {
        return courseCatalogAvailable() && properties.getBundle().isEnabled();
    }
}
