package io.ethcontacts.query;

import io.ethcontacts.domain.Contact;
import io.ethcontacts.reconcile.ContactReconciler;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read side of the contacts API. Filtered views are filters over {@link ContactReconciler#listAll()}
 * and keep its display-name order.
 */
@RequiredArgsConstructor
public class ContactQueryService {

    private final ContactReconciler reconciler;

    public List<Contact> listAll() {
        return reconciler.listAll();
    }

    /** Contacts with a non-blank wallet address. */
    public List<Contact> listWithWallet() {
        return filter(Contact::hasEthAddress);
    }

    /** Contacts with a non-blank ENS name, from either store. */
    public List<Contact> listWithEns() {
        return filter(Contact::hasEns);
    }

    public List<Contact> listWithEitherEthField() {
        return filter(Contact::hasEthData);
    }

    public Optional<Contact> getById(String contactId) {
        return reconciler.getById(contactId);
    }

    private List<Contact> filter(Predicate<Contact> predicate) {
        return reconciler.listAll().stream().filter(predicate).toList();
    }
}
