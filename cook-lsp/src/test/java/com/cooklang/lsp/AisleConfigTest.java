package com.cooklang.lsp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("aisle.conf 测试")
class AisleConfigTest {

    @Nested
    @DisplayName("别名表解析")
    class Parse {

        @Test
        @DisplayName("规范名与别名")
        void testCanonicalAndAliases() {
            AliasTable table = AliasTable.parse("[produce]\nonions|yellow onion|brown onion\n\n[dairy]\nmilk\n");
            assertThat(table.size()).isEqualTo(4);

            AliasTable.Entry onions = table.find("onions");
            assertThat(onions.isAlias()).isFalse();
            assertThat(onions.getCategory()).isEqualTo("produce");

            AliasTable.Entry yellow = table.find("Yellow Onion");
            assertThat(yellow.isAlias()).isTrue();
            assertThat(yellow.getCanonicalName()).isEqualTo("onions");

            assertThat(table.find("milk").getCategory()).isEqualTo("dairy");
        }

        @Test
        @DisplayName("格式错误的行被跳过")
        void testLenient() {
            AliasTable table = AliasTable.parse(
                    "orphan\n"
                    + "[broken\n"
                    + "[produce]\n"
                    + "# comment\n"
                    + "|nameless\n"
                    + "  garlic |  \n"
                    + "[]\n"
                    + "lost\n");
            assertThat(table.getEntries()).extracting(AliasTable.Entry::getName).containsExactly("garlic");
            assertThat(table.find("orphan")).isNull();
            assertThat(table.find("lost")).isNull();
        }

        @Test
        @DisplayName("空内容得到空表")
        void testEmpty() {
            assertThat(AliasTable.parse("").isEmpty()).isTrue();
            assertThat(AliasTable.empty().size()).isZero();
        }

        @Test
        @DisplayName("CRLF 换行")
        void testCrlf() {
            AliasTable table = AliasTable.parse("[spices]\r\npepper|black pepper\r\n");
            assertThat(table.find("black pepper").getCanonicalName()).isEqualTo("pepper");
        }
    }

    @Nested
    @DisplayName("文件加载")
    class Load {

        @TempDir
        Path root;

        private void write(String relative, String content) throws IOException {
            Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("按候选顺序选择第一个存在的文件")
        void testLookupOrder() throws IOException {
            write("aisle.conf", "[root]\nroot item\n");
            write("config/aisle.conf", "[config]\nconfig item\n");
            AisleConfig config = new AisleConfig();
            config.load(root);
            assertThat(config.getTable().find("config item")).isNotNull();
            assertThat(config.getTable().find("root item")).isNull();

            write(".cooklang/aisle.conf", "[hidden]\nhidden item\n");
            config.load(root);
            assertThat(config.getTable().find("hidden item")).isNotNull();
            assertThat(config.getTable().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("工作区根目录下的 aisle.conf")
        void testRootFile() throws IOException {
            write("aisle.conf", "[produce]\ntomato\n");
            assertThat(AisleConfig.findConfigFile(root)).isEqualTo(root.resolve("aisle.conf"));
        }

        @Test
        @DisplayName("没有配置文件时别名表为空")
        void testMissingFile() {
            AisleConfig config = new AisleConfig();
            config.replace(AliasTable.parse("[x]\nstale\n"));
            AliasTable loaded = config.load(root);
            assertThat(loaded.isEmpty()).isTrue();
            assertThat(config.getTable().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("没有工作区根目录时别名表为空")
        void testNullRoot() {
            AisleConfig config = new AisleConfig();
            assertThat(config.load(null).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("识别 aisle.conf URI")
    void testIsAisleFile() {
        assertThat(AisleConfig.isAisleFile("file:///work/config/aisle.conf")).isTrue();
        assertThat(AisleConfig.isAisleFile("file:///work/recipe.cook")).isFalse();
        assertThat(AisleConfig.isAisleFile(null)).isFalse();
        assertThat(AisleConfig.isAisleFile("file:///work/notaisle.conf")).isFalse();
        assertThat(AisleConfig.isAisleFile("file:///work/aisle.conf.bak")).isFalse();
        assertThat(AisleConfig.isAisleFile("aisle.conf")).isTrue();
    }
}
