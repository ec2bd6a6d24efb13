package tech.yump.rotator.template;

import tech.yump.rotator.rotation.RotationErrorKind;
import tech.yump.rotator.rotation.RotationException;

public class TemplateNotFoundException extends RotationException {
    public TemplateNotFoundException(String templateName) {
        super(RotationErrorKind.TEMPLATE_NOT_FOUND, "Provider template not found: " + templateName);
    }
}
