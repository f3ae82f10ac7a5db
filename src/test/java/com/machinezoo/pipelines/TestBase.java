// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import static org.awaitility.Awaitility.*;
import java.time.*;
import org.awaitility.pollinterval.*;
import org.junit.jupiter.api.*;
import com.machinezoo.noexception.*;

public abstract class TestBase {
	@BeforeAll
	public static void awaitility() {
		setDefaultPollInterval(new FibonacciPollInterval());
		setDefaultTimeout(Duration.ofSeconds(30));
	}
	public static void sleep(int millis) {
		Exceptions.sneak().run(() -> Thread.sleep(millis));
	}
	public static void settle() {
		sleep(100);
	}
}
