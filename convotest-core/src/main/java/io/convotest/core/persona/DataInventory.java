package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DataInventory(
    String parentFirstName,
    String parentLastName,
    String parentPhone,
    String parentEmail,
    List<ChildData> children,
    Boolean hasInsurance,
    String insuranceProvider,
    String insuranceId,
    String preferredLocation,
    List<String> preferredDays,
    String preferredTimeOfDay,
    DateRange preferredDateRange,
    Boolean previousVisitToOffice,
    Boolean previousOrthoTreatment
) {
    public DataInventory {
        parentFirstName = parentFirstName == null ? "" : parentFirstName.trim();
        parentLastName = parentLastName == null ? "" : parentLastName.trim();
        parentPhone = parentPhone == null ? "" : parentPhone.trim();
        children = children == null ? List.of() : List.copyOf(children);
        preferredDays = preferredDays == null ? List.of() : List.copyOf(preferredDays);
    }

    public String parentFullName() {
        return (parentFirstName + " " + parentLastName).trim();
    }

    public ChildData child(int index) {
        if (children.isEmpty()) {
            return null;
        }
        if (index < 0 || index >= children.size()) {
            return children.get(0);
        }
        return children.get(index);
    }
}
