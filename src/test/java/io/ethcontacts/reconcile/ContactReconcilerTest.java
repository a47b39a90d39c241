package io.ethcontacts.reconcile;

import io.ethcontacts.classifier.AuxiliaryFieldClassifier;
import io.ethcontacts.domain.Contact;
import io.ethcontacts.source.ContactDataSource;
import io.ethcontacts.source.EnsPreferenceStore;
import io.ethcontacts.source.InMemoryContactDataSource;
import io.ethcontacts.source.InMemoryEnsPreferenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PermissionDeniedDataAccessException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContactReconcilerTest {

    private static final String ADDRESS = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";

    private final AuxiliaryFieldClassifier classifier = new AuxiliaryFieldClassifier();
    private InMemoryContactDataSource contacts;
    private InMemoryEnsPreferenceStore preferences;
    private ContactReconciler reconciler;

    @BeforeEach
    void setUp() {
        contacts = new InMemoryContactDataSource();
        preferences = new InMemoryEnsPreferenceStore();
        reconciler = new ContactReconciler(contacts, preferences, classifier);
    }

    @Nested
    @DisplayName("listAll()")
    class ListAll {

        @Test
        @DisplayName("merges name, phone, email and photo rows into one contact")
        void mergesRowsPerContact() {
            contacts.withName(1, "Alice", ADDRESS)
                    .withPhone(1, "+1555")
                    .withEmail(1, "alice@example.com")
                    .withPhoto(1, "content://photo/1");

            List<Contact> result = reconciler.listAll();

            assertThat(result).containsExactly(Contact.builder("1")
                    .displayName("Alice")
                    .phoneNumber("+1555")
                    .email("alice@example.com")
                    .photoUri("content://photo/1")
                    .ethAddress(ADDRESS)
                    .build());
        }

        @Test
        @DisplayName("sorts case-insensitively by display name")
        void sortsByDisplayNameIgnoringCase() {
            contacts.withName(1, "bob", null)
                    .withName(2, "Alice", null)
                    .withName(3, "charlie", null);

            assertThat(reconciler.listAll())
                    .extracting(Contact::displayName)
                    .containsExactly("Alice", "bob", "charlie");
        }

        @Test
        @DisplayName("equal names keep contact id order")
        void tiesKeepScanOrder() {
            contacts.withName(2, "sam", null).withName(1, "Sam", null);

            assertThat(reconciler.listAll())
                    .extracting(Contact::contactId)
                    .containsExactly("1", "2");
        }

        @Test
        @DisplayName("ENS from the auxiliary slot wins over the preference override")
        void storeEnsWinsOverOverride() {
            contacts.withName(1, "Alice", "a.eth");
            preferences.withOverride(1, "b.eth");

            assertThat(reconciler.listAll()).singleElement()
                    .satisfies(c -> assertThat(c.ensName()).contains("a.eth"));
        }

        @Test
        @DisplayName("override fills ENS alongside a wallet address")
        void overrideFallsBackBesideAddress() {
            contacts.withName(1, "Alice", ADDRESS);
            preferences.withOverride(1, "c.eth");

            Contact contact = reconciler.listAll().get(0);

            assertThat(contact.ethAddress()).contains(ADDRESS);
            assertThat(contact.ensName()).contains("c.eth");
        }

        @Test
        @DisplayName("unclassified auxiliary value feeds neither Ethereum field")
        void unclassifiedValueIgnored() {
            contacts.withName(1, "Alice", "nickname");

            Contact contact = reconciler.listAll().get(0);

            assertThat(contact.ethAddress()).isEmpty();
            assertThat(contact.ensName()).isEmpty();
            assertThat(contact.displayName()).isEqualTo("Alice");
        }

        @Test
        @DisplayName("contact without a name row is listed with empty name and still gets its override")
        void contactWithoutNameRow() {
            contacts.withPhone(5, "+1000");
            preferences.withOverride(5, "phone-only.eth");

            assertThat(reconciler.listAll()).containsExactly(Contact.builder("5")
                    .displayName("")
                    .phoneNumber("+1000")
                    .ensName("phone-only.eth")
                    .build());
        }

        @Test
        @DisplayName("first name row decides name and Ethereum field")
        void firstNameRowWins() {
            contacts.withName(1, "Alice", "first.eth").withName(1, "Alicia", ADDRESS);

            Contact contact = reconciler.listAll().get(0);

            assertThat(contact.displayName()).isEqualTo("Alice");
            assertThat(contact.ensName()).contains("first.eth");
            assertThat(contact.ethAddress()).isEmpty();
        }

        @Test
        @DisplayName("permission denial degrades to an empty list")
        void permissionDeniedReturnsEmpty() {
            ContactDataSource denied = mock(ContactDataSource.class);
            when(denied.listDataRows(anySet())).thenThrow(new PermissionDeniedDataAccessException("not authorized", null));

            assertThat(new ContactReconciler(denied, preferences, classifier).listAll()).isEmpty();
        }

        @Test
        @DisplayName("failing override lookup leaves the contact without an override")
        void overrideFailureIsIgnored() {
            contacts.withName(1, "Alice", null);
            EnsPreferenceStore failing = mock(EnsPreferenceStore.class);
            when(failing.getEnsOverride(anyLong())).thenThrow(new DataAccessResourceFailureException("down"));

            List<Contact> result = new ContactReconciler(contacts, failing, classifier).listAll();

            assertThat(result).singleElement().satisfies(c -> assertThat(c.ensName()).isEmpty());
        }
    }

    @Nested
    @DisplayName("getById(String)")
    class GetById {

        @Test
        void missingContactIsEmpty() {
            assertThat(reconciler.getById("42")).isEmpty();
        }

        @Test
        void nonNumericIdIsEmpty() {
            contacts.withName(1, "Alice", null);

            assertThat(reconciler.getById("abc")).isEmpty();
            assertThat(reconciler.getById("")).isEmpty();
            assertThat(reconciler.getById(null)).isEmpty();
        }

        @Test
        @DisplayName("id not in canonical decimal form is not found")
        void nonCanonicalIdIsEmpty() {
            contacts.withName(7, "Alice", null);

            assertThat(reconciler.getById(" 7")).isEmpty();
            assertThat(reconciler.getById("7 ")).isEmpty();
            assertThat(reconciler.getById("007")).isEmpty();
            assertThat(reconciler.getById("+7")).isEmpty();
            assertThat(reconciler.getById("7")).hasValueSatisfying(c -> assertThat(c.contactId()).isEqualTo("7"));
        }

        @Test
        @DisplayName("contact without a display name is not found")
        void emptyDisplayNameIsNotFound() {
            contacts.withPhone(5, "+1000");

            assertThat(reconciler.getById("5")).isEmpty();
        }

        @Test
        @DisplayName("applies the same ENS precedence as listing")
        void appliesEnsPrecedence() {
            contacts.withName(1, "Alice", "a.eth").withName(2, "Bob", ADDRESS);
            preferences.withOverride(1, "b.eth").withOverride(2, "c.eth");

            assertThat(reconciler.getById("1")).hasValueSatisfying(c -> assertThat(c.ensName()).contains("a.eth"));
            assertThat(reconciler.getById("2")).hasValueSatisfying(c -> {
                assertThat(c.ethAddress()).contains(ADDRESS);
                assertThat(c.ensName()).contains("c.eth");
            });
        }

        @Test
        @DisplayName("returns the same contact as listing for every named contact")
        void matchesListing() {
            contacts.withName(1, "Alice", ADDRESS)
                    .withPhone(1, "+1555")
                    .withPhone(1, "+1666")
                    .withEmail(1, "alice@example.com")
                    .withPhoto(1, "content://photo/1")
                    .withName(2, "bob", "bob.eth")
                    .withName(3, "Carol", "nickname")
                    .withEmail(3, "carol@example.com");
            preferences.withOverride(1, "alice.eth").withOverride(2, "ignored.eth");

            List<Contact> listed = reconciler.listAll();

            assertThat(listed).hasSize(3);
            for (Contact contact : listed) {
                assertThat(reconciler.getById(contact.contactId())).contains(contact);
            }
        }

        @Test
        @DisplayName("store failure is reported as not found")
        void storeFailureIsEmpty() {
            ContactDataSource failing = mock(ContactDataSource.class);
            when(failing.getContactHeader(1L)).thenThrow(new PermissionDeniedDataAccessException("not authorized", null));

            assertThat(new ContactReconciler(failing, preferences, classifier).getById("1")).isEmpty();
        }
    }
}
