package com.williamcallahan.orderedlists;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class OrderedListsApplicationTests {

    @Test
    void contextLoads() {
    }

}
