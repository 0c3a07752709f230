package com.ktb.wordfilter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ktb.wordfilter.service.WordFilterService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "wordfilter.dictionary.path=classpath:dictionary/*.txt",
        "wordfilter.mask.placeholder=#"
})
@AutoConfigureMockMvc
class WordFilterApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WordFilterService wordFilterService;

    @Test
    void dictionaryLoadedAtStartup() {
        assertThat(wordFilterService.status().getWordCount()).isEqualTo(6);
        assertThat(wordFilterService.status().getVersion()).isEqualTo(1L);
    }

    @Test
    void filterEndpoint() throws Exception {
        mockMvc.perform(post("/filter").param("message", "xabcx, 바보 Bad Word!"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("x###x, ## ########!"));
    }

    @Test
    void validateEndpoint() throws Exception {
        mockMvc.perform(post("/validate").param("message", "perfectly fine"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(true));

        mockMvc.perform(post("/validate").param("message", "EVIL plan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value(false));
    }
}
