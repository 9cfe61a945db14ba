package com.polytick.core.market;

import java.util.List;
import java.util.Objects;

public record SideHandles(String yesHandle, String noHandle) {

  public SideHandles {
    Objects.requireNonNull(yesHandle, "yesHandle");
    Objects.requireNonNull(noHandle, "noHandle");
    if (yesHandle.equals(noHandle)) {
      throw new IllegalArgumentException("yes and no handles must differ: " + yesHandle);
    }
  }

  public List<String> both() {
    return List.of(yesHandle, noHandle);
  }
}
