/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class AccountIdTest {

  @Test
  void ordersBytesAsUnsigned() {
    byte[] low = new byte[AccountId.LENGTH];
    low[0] = 0x7f;
    byte[] high = new byte[AccountId.LENGTH];
    high[0] = (byte) 0x80;

    assertTrue(AccountId.of(low).compareTo(AccountId.of(high)) < 0);
  }

  @Test
  void hexRoundTripIsCaseInsensitive() {
    String hex = "AB".repeat(AccountId.LENGTH);
    AccountId id = AccountId.fromHex(hex);

    assertEquals("ab".repeat(AccountId.LENGTH), id.toHex());
    assertEquals(id, AccountId.fromHex(id.toHex()));
  }

  @Test
  void copiesInputBytes() {
    byte[] bytes = new byte[AccountId.LENGTH];
    AccountId id = AccountId.of(bytes);
    bytes[0] = 1;

    assertNotEquals(bytes[0], id.toBytes()[0]);
    byte[] out = id.toBytes();
    out[1] = 9;
    assertTrue(Arrays.equals(new byte[AccountId.LENGTH], id.toBytes()));
  }

  @Test
  void rejectsMalformedIdentities() {
    TrustLineException shortBytes =
        assertThrows(TrustLineException.class, () -> AccountId.of(new byte[31]));
    assertEquals(ErrorCode.INVALID_ACCOUNT, shortBytes.errorCode());

    assertEquals(
        ErrorCode.INVALID_ACCOUNT,
        assertThrows(TrustLineException.class, () -> AccountId.fromHex("zz".repeat(32)))
            .errorCode());
    assertEquals(
        ErrorCode.INVALID_ACCOUNT,
        assertThrows(TrustLineException.class, () -> AccountId.fromHex(null)).errorCode());
  }

  @Test
  void toStringShowsShortPrefix() {
    AccountId id = AccountId.fromHex("0123456789abcdef".repeat(4));
    assertEquals("01234567", id.toString());
  }
}
