package com.bftchain.node_runner;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {
		"consensus.validator-id=val1",
		"consensus.storage-dir=target/context-test-data",
		"consensus.timeout-propose-ms=200",
		"consensus.timeout-commit-ms=100"
})
class NodeRunnerApplicationTests {

	@Autowired
	private ApplicationContext context;

	@Test
	void contextLoads() {
		assertNotNull(context, "Application context should load");
		assertTrue(context.containsBean("consensusNodeManager"), "ConsensusNodeManager bean should exist");
		assertTrue(context.containsBean("consensusEngine"), "ConsensusEngine should exist");
		assertTrue(context.containsBean("consensusController"), "Consensus endpoint should be scanned");
		assertTrue(context.containsBean("chainController"), "Chain endpoint should exist");
	}

}
