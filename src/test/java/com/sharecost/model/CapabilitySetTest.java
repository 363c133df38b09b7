package com.sharecost.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Algebraic properties of capability sets, checked over every combination of unset, granted and
 * denied flags.
 */
class CapabilitySetTest {
  private static final Boolean[] STATES = {null, Boolean.TRUE, Boolean.FALSE};
  private static final List<CapabilitySet> EVERY_SET = new ArrayList<>();

  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeAll
  static void enumerate() {
    Capability[] capabilities = Capability.values();
    int combinations = (int) Math.pow(STATES.length, capabilities.length);
    for (int n = 0; n < combinations; n++) {
      Map<Capability, Boolean> flags = new EnumMap<>(Capability.class);
      int rest = n;
      for (Capability capability : capabilities) {
        Boolean state = STATES[rest % STATES.length];
        rest /= STATES.length;
        if (state != null) {
          flags.put(capability, state);
        }
      }
      EVERY_SET.add(CapabilitySet.of(flags));
    }
  }

  @Test
  void unsetFlagsResolveToGranted() {
    CapabilitySet legacy = CapabilitySets.unset();
    assertTrue(legacy.hasDeleteGroup());
    assertTrue(legacy.hasManageMembers());
    assertTrue(legacy.hasUpdatePayment());
    assertTrue(legacy.hasAddExpenses());
    assertTrue(legacy.hasEditExpenses());
    assertTrue(legacy.hasAll());
    assertEquals(CapabilitySet.all(), legacy);
  }

  @Test
  void hasAllRequiresEveryFlag() {
    for (Capability capability : Capability.values()) {
      CapabilitySet missingOne = CapabilitySets.allExcept(capability);
      assertFalse(missingOne.hasAll(), capability.name());
      assertFalse(missingOne.has(capability));
    }
  }

  @Test
  void capByNeverExceedsEitherSide() {
    for (CapabilitySet a : EVERY_SET) {
      for (CapabilitySet b : EVERY_SET) {
        CapabilitySet capped = a.capBy(b);
        for (Capability x : Capability.values()) {
          if (capped.has(x)) {
            assertTrue(a.has(x) && b.has(x), a + " capBy " + b);
          }
        }
        assertEquals(capped, b.capBy(a));
      }
    }
  }

  @Test
  void unionNeverFallsBelowEitherSide() {
    for (CapabilitySet a : EVERY_SET) {
      for (CapabilitySet b : EVERY_SET) {
        CapabilitySet union = a.unionWith(b);
        for (Capability x : Capability.values()) {
          if (a.has(x) || b.has(x)) {
            assertTrue(union.has(x), a + " union " + b);
          }
        }
        assertEquals(union, b.unionWith(a));
      }
    }
  }

  @Test
  void allIsIdentityForCapByAndAbsorbingForUnion() {
    for (CapabilitySet a : EVERY_SET) {
      assertEquals(a, a.capBy(CapabilitySet.all()));
      assertEquals(CapabilitySet.all(), a.unionWith(CapabilitySet.all()));
    }
  }

  @Test
  void transformsAreAssociative() {
    List<CapabilitySet> sample = EVERY_SET;
    for (int i = 0; i < sample.size(); i += 7) {
      for (int j = 0; j < sample.size(); j += 11) {
        for (int k = 0; k < sample.size(); k += 13) {
          CapabilitySet a = sample.get(i);
          CapabilitySet b = sample.get(j);
          CapabilitySet c = sample.get(k);
          assertEquals(a.capBy(b).capBy(c), a.capBy(b.capBy(c)));
          assertEquals(a.unionWith(b).unionWith(c), a.unionWith(b.unionWith(c)));
        }
      }
    }
  }

  @Test
  void repeatedAttenuationCannotRegainARight() {
    CapabilitySet issuer = CapabilitySets.allExcept(Capability.EDIT_EXPENSES);
    CapabilitySet derived = CapabilitySet.all().capBy(issuer);
    CapabilitySet derivedAgain = CapabilitySets.unset().capBy(derived);
    assertFalse(derivedAgain.hasEditExpenses());
    assertTrue(derivedAgain.hasAddExpenses());
  }

  @Test
  void writesCompactNamesAndOmitsUnsetFlags() throws Exception {
    CapabilitySet set = CapabilitySets.flags(Capability.MANAGE_MEMBERS, false, Capability.ADD_EXPENSES, true);

    String json = objectMapper.writeValueAsString(set);

    assertEquals("{\"mm\":false,\"ae\":true}", json);
  }

  @Test
  void readsCompactAndVerboseNames() throws Exception {
    CapabilitySet compact = objectMapper.readValue("{\"mm\":false,\"ee\":true}", CapabilitySet.class);
    CapabilitySet verbose = objectMapper.readValue("{\"manage_members\":false,\"edit_expenses\":true}", CapabilitySet.class);

    assertEquals(compact, verbose);
    assertEquals(Boolean.FALSE, verbose.raw(Capability.MANAGE_MEMBERS));
    assertEquals(Boolean.TRUE, verbose.raw(Capability.EDIT_EXPENSES));
    assertNull(verbose.raw(Capability.DELETE_GROUP));
    assertTrue(verbose.hasDeleteGroup());
  }

  @Test
  void jsonRoundTripKeepsUnsetFlagsUnset() throws Exception {
    CapabilitySet set = CapabilitySets.flags(Capability.DELETE_GROUP, false);

    CapabilitySet read = objectMapper.readValue(objectMapper.writeValueAsString(set), CapabilitySet.class);

    for (Capability capability : Capability.values()) {
      assertEquals(set.raw(capability), read.raw(capability), capability.name());
    }
  }
}
