package com.gymadmin.backend.modules.staff.presentation;

import java.util.UUID;

/**
 * Request body carrying a staff PIN confirmation for {@code @RequirePinStepUp} routes.
 */
public interface PinConfirmedRequest {

    UUID staffId();

    String staffPin();
}
