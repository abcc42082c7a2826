package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolution of investigation (camt.029).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt029Message extends PaymentMessage implements InvestigationCase {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "assignment_id", "case_id", "investigation_status", "cancellation_details");

    private String creationDateTime;

    private String assignmentId;

    private String caseId;

    /**
     * Confirmation status of the investigation (Sts/Conf).
     */
    private String investigationStatus;

    @Builder.Default
    private List<Map<String, String>> cancellationDetails = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_029;
    }
}
