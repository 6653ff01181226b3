package ca.gc.cra.ldiftap.domain.ldif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EntryFilterPolicyTest {

  @Test
  void defaultsSuppressOperationalAttributesOnly() {
    EntryFilterPolicy policy = EntryFilterPolicy.defaults();

    assertTrue(policy.strictParsing());
    assertTrue(policy.acceptsAttribute("cn"));
    assertFalse(policy.acceptsAttribute("createTimestamp"));
    assertFalse(policy.acceptsAttribute("ENTRYUUID"));
  }

  @Test
  void includeOperationalKeepsServerAttributes() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.empty(), Set.of(), Optional.empty(), Set.of(), true, null, true);

    assertTrue(policy.acceptsAttribute("modifyTimestamp"));
  }

  @Test
  void allowListAndDenyListAreIndependentAndCaseInsensitive() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.empty(),
        Set.of(),
        Optional.of(Set.of("CN", "mail", "uid")),
        Set.of("UID"),
        false,
        null,
        true);

    assertTrue(policy.acceptsAttribute("cn"));
    assertTrue(policy.acceptsAttribute("Mail"));
    assertFalse(policy.acceptsAttribute("uid"));
    assertFalse(policy.acceptsAttribute("sn"));
  }

  @Test
  void baseDnFilterMatchesSuffixIgnoringCase() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.of(" DC=Example,DC=Com "), Set.of(), Optional.empty(), Set.of(), false, null, true);

    assertEquals(Optional.of("dc=example,dc=com"), policy.baseDnFilter());
    assertTrue(policy.acceptsEntry(entry("cn=a,ou=People,dc=example,dc=com", List.of())));
    assertFalse(policy.acceptsEntry(entry("cn=a,dc=other,dc=org", List.of())));
  }

  @Test
  void objectClassFilterUsesOrSemantics() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.empty(), Set.of("inetOrgPerson", "groupOfNames"), Optional.empty(), Set.of(), false, null, true);

    assertTrue(policy.acceptsEntry(entry("cn=g", List.of("top", "groupOfNames"))));
    assertTrue(policy.acceptsEntry(entry("cn=p", List.of("InetOrgPerson"))));
    assertFalse(policy.acceptsEntry(entry("ou=x", List.of("organizationalUnit"))));
    assertFalse(policy.acceptsEntry(entry("ou=y", List.of())));
  }

  @Test
  void withStrictParsingKeepsFilters() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.of("dc=example"), Set.of(), Optional.empty(), Set.of("mail"), false, null, true);

    EntryFilterPolicy lenient = policy.withStrictParsing(false);

    assertFalse(lenient.strictParsing());
    assertEquals(policy.baseDnFilter(), lenient.baseDnFilter());
    assertEquals(policy.excludeAttributes(), lenient.excludeAttributes());
  }

  private static LdifEntry entry(String dn, List<String> objectClass) {
    return new LdifEntry(dn, Map.of(), objectClass, Optional.empty(), "test.ldif", 1, 0);
  }
}
