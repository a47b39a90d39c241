package io.ethcontacts.reconcile;

import io.ethcontacts.classifier.AuxiliaryFieldClassifier;
import io.ethcontacts.classifier.AuxiliaryValue;
import io.ethcontacts.domain.DataRow;
import lombok.Getter;

/**
 * Per-contact scratch record filled while scanning data rows. Never leaves the reconciler.
 * Every field is first-row-wins.
 */
@Getter
final class TempContactData {

    private boolean nameSeen;
    private String displayName;
    private AuxiliaryValue auxiliary = AuxiliaryValue.absent();
    private String phoneNumber;
    private String email;
    private String photoUri;

    void accept(DataRow row, AuxiliaryFieldClassifier classifier) {
        switch (row.mimeType()) {
            case STRUCTURED_NAME -> {
                if (!nameSeen) {
                    nameSeen = true;
                    displayName = row.primaryValue();
                    auxiliary = classifier.toAuxiliaryValue(row.auxiliaryValue());
                }
            }
            case PHONE -> {
                if (phoneNumber == null) phoneNumber = row.primaryValue();
            }
            case EMAIL -> {
                if (email == null) email = row.primaryValue();
            }
            case PHOTO -> {
                if (photoUri == null) photoUri = row.photoUri();
            }
        }
    }
}
